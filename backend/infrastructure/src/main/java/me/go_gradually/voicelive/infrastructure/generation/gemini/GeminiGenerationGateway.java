package me.go_gradually.voicelive.infrastructure.generation.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.pipeline.model.GenerationOptions;
import me.go_gradually.voicelive.application.pipeline.port.GenerationGateway;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class GeminiGenerationGateway implements GenerationGateway {
    private final WebClient webClient;
    private final AppProperties.Gemini gemini;
    private final double temperature;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiGenerationGateway(@Qualifier("geminiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.gemini = properties.getIntegrations().getGemini();
        this.temperature = properties.getUpstream().getTemperature();
    }

    @Override
    public String generate(String prompt, GenerationOptions options) throws Exception {
        String response = requestGemini(prompt, options);
        return extractContent(response);
    }

    private String requestGemini(String prompt, GenerationOptions options) {
        return webClient.post()
                .uri("/v1beta/models/" + gemini.getModel() + ":generateContent?key=" + gemini.getApiKey())
                .bodyValue(requestPayload(prompt, options))
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    private Map<String, Object> requestPayload(String prompt, GenerationOptions options) {
        Map<String, Object> payload = new HashMap<>();
        if (options != null && options.systemInstruction() != null && !options.systemInstruction().isBlank()) {
            payload.put("system_instruction", Map.of("parts", List.of(Map.of("text", options.systemInstruction()))));
        }
        payload.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", prompt))
        )));
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", temperature);
        if (options != null && options.maxTokens() > 0) {
            generationConfig.put("maxOutputTokens", options.maxTokens());
        }
        payload.put("generationConfig", generationConfig);
        return payload;
    }

    private String extractContent(String response) throws Exception {
        JsonNode root = objectMapper.readTree(response);
        JsonNode content = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (content.isMissingNode()) {
            throw new IllegalStateException("Gemini response missing content");
        }
        return content.asText();
    }
}
