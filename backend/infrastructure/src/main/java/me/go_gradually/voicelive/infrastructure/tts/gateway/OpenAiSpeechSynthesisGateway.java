package me.go_gradually.voicelive.infrastructure.tts.gateway;

import me.go_gradually.voicelive.application.pipeline.model.VoiceOptions;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synthesizes raw 24 kHz 16-bit mono PCM, the same framing the live upstream streams back.
 */
@Component
public class OpenAiSpeechSynthesisGateway implements SpeechSynthesisGateway {
    private static final String ENDPOINT = "/v1/audio/speech";

    private final WebClient webClient;
    private final AppProperties.OpenAi openAi;

    public OpenAiSpeechSynthesisGateway(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.openAi = properties.getIntegrations().getOpenai();
    }

    @Override
    public byte[] synthesize(String text, String language, VoiceOptions voice) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", openAi.getTtsModel());
        payload.put("voice", voice == null || voice.voice() == null ? openAi.getTtsVoice() : voice.voice());
        payload.put("input", text);
        payload.put("response_format", "pcm");

        byte[] audio = webClient.post()
                .uri(ENDPOINT)
                .header("Authorization", "Bearer " + openAi.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(byte[].class)
                .block();
        if (audio == null || audio.length == 0) {
            throw new IllegalStateException("Speech synthesis returned no audio");
        }
        return audio;
    }
}
