package me.go_gradually.voicelive.infrastructure.stt.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.pipeline.model.TranscriptionOptions;
import me.go_gradually.voicelive.application.pipeline.port.TranscriptionGateway;
import me.go_gradually.voicelive.domain.quality.TranscriptionResult;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;

@Component
public class OpenAiTranscriptionGateway implements TranscriptionGateway {
    private static final String ENDPOINT = "/v1/audio/transcriptions";

    private final WebClient webClient;
    private final AppProperties.OpenAi openAi;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiTranscriptionGateway(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.openAi = properties.getIntegrations().getOpenai();
    }

    @Override
    public TranscriptionResult transcribe(byte[] audio, String language, TranscriptionOptions options) throws Exception {
        String response = callOpenAi(WavEncoder.wrapPcm16(audio, options.sampleRate()), language);
        JsonNode root = objectMapper.readTree(response);
        String text = root.path("text").asText("").trim();
        String detected = toLanguageCode(root.path("language").asText(""));
        return new TranscriptionResult(true, text, confidenceOf(root, text), true, detected);
    }

    private String callOpenAi(byte[] wav, String language) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", wav)
                .header("Content-Disposition", "form-data; name=file; filename=audio.wav")
                .contentType(MediaType.parseMediaType("audio/wav"));
        builder.part("model", openAi.getSttModel());
        builder.part("response_format", "verbose_json");
        String hint = languageHint(language);
        if (hint != null) {
            builder.part("language", hint);
        }

        return webClient.post()
                .uri(ENDPOINT)
                .header("Authorization", "Bearer " + openAi.getApiKey())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    /**
     * Mean per-segment probability derived from {@code avg_logprob}. Without segments, any text counts as certain.
     */
    static double confidenceOf(JsonNode root, String text) {
        JsonNode segments = root.path("segments");
        if (!segments.isArray() || segments.isEmpty()) {
            return text.isEmpty() ? 0.0 : 1.0;
        }
        double sum = 0;
        int count = 0;
        for (JsonNode segment : segments) {
            if (segment.has("avg_logprob")) {
                sum += Math.min(1.0, Math.exp(segment.path("avg_logprob").asDouble()));
                count++;
            }
        }
        return count == 0 ? 1.0 : sum / count;
    }

    /**
     * verbose_json reports the detected language by English name ("hindi"); returns {@code null} when unknown.
     */
    static String toLanguageCode(String reported) {
        if (reported == null || reported.isBlank()) {
            return null;
        }
        String normalized = reported.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() == 2) {
            return normalized;
        }
        for (String code : Locale.getISOLanguages()) {
            if (new Locale(code).getDisplayLanguage(Locale.ENGLISH).toLowerCase(Locale.ROOT).equals(normalized)) {
                return code;
            }
        }
        return null;
    }

    // 전사 API는 ISO-639-1 두 글자 코드만 받는다.
    private static String languageHint(String language) {
        if (language == null || language.isBlank() || "auto".equalsIgnoreCase(language)) {
            return null;
        }
        String base = language.split("[-_]")[0].toLowerCase(Locale.ROOT);
        return base.length() == 2 ? base : null;
    }
}
