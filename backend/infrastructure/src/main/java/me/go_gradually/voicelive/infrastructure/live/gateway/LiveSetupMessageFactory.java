package me.go_gradually.voicelive.infrastructure.live.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.live.model.UpstreamSetup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the first message of a live session: model, generation config, activity detection, instruction and tools.
 */
class LiveSetupMessageFactory {
    static final String RESPONSE_TOOL = "respond_to_financial_query";

    private static final List<String> TOPICS = List.of(
            "loans", "credit", "savings", "insurance", "banking", "payments", "investments", "pensions",
            "subsidies", "government_schemes", "financial_literacy", "account_opening", "money_transfer", "bills",
            "fraud_alert", "scam_warning", "phishing_detection", "suspicious_activity", "general_inquiry",
            "clarification", "follow_up", "other_financial");
    private static final List<String> STAGES = List.of(
            "greeting", "understanding_need", "gathering_details", "providing_information", "explaining_options",
            "clarifying", "warning_fraud", "concluding", "casual_chat");
    private static final List<String> INTENTS = List.of(
            "get_loan", "open_account", "understand_scheme", "check_eligibility", "compare_options", "report_fraud",
            "learn_about_topic", "get_help", "clarify_doubt", "casual_question", "continue_previous_topic");

    private final ObjectMapper objectMapper;
    private final String modelPath;

    LiveSetupMessageFactory(ObjectMapper objectMapper, String projectId, String location, String model) {
        this.objectMapper = objectMapper;
        this.modelPath = "projects/" + projectId + "/locations/" + location + "/publishers/google/models/" + model;
    }

    String modelPath() {
        return modelPath;
    }

    String create(UpstreamSetup setup) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelPath);
        body.put("generationConfig", generationConfig(setup));
        body.put("realtimeInputConfig", Map.of(
                "automaticActivityDetection", Map.of(
                        "disabled", false,
                        "silenceDurationMs", Math.round(setup.vadSilenceSeconds() * 1000)
                )
        ));
        String instruction = setup.systemInstruction() == null ? "" : setup.systemInstruction();
        body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", instruction))));
        body.put("tools", List.of(Map.of("functionDeclarations", List.of(responseTool()))));
        return objectMapper.writeValueAsString(Map.of("setup", body));
    }

    private Map<String, Object> generationConfig(UpstreamSetup setup) {
        Map<String, Object> speechConfig = new LinkedHashMap<>();
        speechConfig.put("voiceConfig", Map.of("prebuiltVoiceConfig", Map.of("voiceName", setup.voiceName())));
        // languageCode가 없으면 업스트림이 언어를 자동 감지한다.
        if (setup.languageCode() != null) {
            speechConfig.put("languageCode", setup.languageCode());
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("temperature", setup.temperature());
        config.put("maxOutputTokens", setup.maxOutputTokens());
        config.put("responseModalities", List.of("AUDIO"));
        config.put("speechConfig", speechConfig);
        return config;
    }

    private Map<String, Object> responseTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("response", Map.of(
                "type", "string",
                "description", "Natural conversational reply in the user's language, at most 40 words, no formatting."
        ));
        properties.put("topic", Map.of("type", "string", "description", "Main financial topic in this turn", "enum", TOPICS));
        properties.put("conversation_stage", Map.of("type", "string", "description", "Current stage of the conversation", "enum", STAGES));
        properties.put("user_intent", Map.of("type", "string", "description", "What the user wants to accomplish", "enum", INTENTS));

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);
        parameters.put("required", List.of("response"));

        Map<String, Object> declaration = new LinkedHashMap<>();
        declaration.put("name", RESPONSE_TOOL);
        declaration.put("description", "Answer a financial question conversationally and warn about fraud or scams immediately.");
        declaration.put("parameters", parameters);
        return declaration;
    }
}
