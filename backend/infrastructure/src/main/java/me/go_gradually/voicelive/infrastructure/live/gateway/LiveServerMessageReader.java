package me.go_gradually.voicelive.infrastructure.live.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.live.model.ToolCall;
import me.go_gradually.voicelive.application.live.port.UpstreamEventListener;
import me.go_gradually.voicelive.domain.live.UsageCounters.UsageReport;

import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Dispatches one server message to the session listener. A message may carry several sections at once.
 */
class LiveServerMessageReader {
    private static final Logger log = Logger.getLogger(LiveServerMessageReader.class.getName());
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final UpstreamEventListener listener;
    private final CompletableFuture<Void> setupAcknowledged;

    LiveServerMessageReader(ObjectMapper objectMapper,
                            UpstreamEventListener listener,
                            CompletableFuture<Void> setupAcknowledged) {
        this.objectMapper = objectMapper;
        this.listener = listener;
        this.setupAcknowledged = setupAcknowledged;
    }

    void read(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception e) {
            log.warning("live.gateway.unparsable_message length=" + (payload == null ? 0 : payload.length()));
            listener.onError(new IllegalStateException("Failed to parse live server message", e));
            return;
        }
        if (root.has("setupComplete")) {
            setupAcknowledged.complete(null);
        }
        JsonNode serverContent = root.path("serverContent");
        if (serverContent.isObject()) {
            readServerContent(serverContent);
        }
        JsonNode functionCalls = root.path("toolCall").path("functionCalls");
        for (JsonNode call : functionCalls) {
            listener.onToolCall(new ToolCall(
                    call.path("id").asText(""),
                    call.path("name").asText(""),
                    toArgs(call.path("args"))
            ));
        }
        JsonNode usage = root.path("usageMetadata");
        if (usage.isObject()) {
            listener.onUsage(toUsage(usage));
        }
        JsonNode error = root.path("error");
        if (error.isObject()) {
            listener.onError(new IllegalStateException(error.path("message").asText("Live server error")));
        }
    }

    private void readServerContent(JsonNode serverContent) {
        for (JsonNode part : serverContent.path("modelTurn").path("parts")) {
            JsonNode inlineData = part.path("inlineData");
            if (inlineData.path("mimeType").asText("").startsWith("audio/pcm")) {
                String data = inlineData.path("data").asText("");
                if (!data.isEmpty()) {
                    listener.onAudioChunk(Base64.getDecoder().decode(data));
                }
            }
            String text = part.path("text").asText("");
            if (!text.isEmpty()) {
                listener.onText(text);
            }
        }
        if (serverContent.path("interrupted").asBoolean(false)) {
            listener.onInterrupted();
        }
        if (serverContent.path("turnComplete").asBoolean(false)) {
            listener.onTurnComplete();
        }
    }

    private Map<String, Object> toArgs(JsonNode args) {
        if (!args.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(args, ARGS_TYPE);
    }

    private UsageReport toUsage(JsonNode usage) {
        long[] prompt = modalityTokens(usage.path("promptTokensDetails"));
        long[] response = modalityTokens(usage.path("responseTokensDetails"));
        return new UsageReport(
                usage.path("totalTokenCount").asLong(0),
                usage.path("promptTokenCount").asLong(0),
                usage.path("candidatesTokenCount").asLong(usage.path("responseTokenCount").asLong(0)),
                prompt[0],
                response[0],
                prompt[1],
                response[1]
        );
    }

    // [audio, text]. 세부 항목은 modality/tokenCount 형식과 audioTokens/textTokens 형식 둘 다 온다.
    private long[] modalityTokens(JsonNode details) {
        long[] tokens = new long[2];
        for (JsonNode detail : details) {
            String modality = detail.path("modality").asText("");
            if ("AUDIO".equalsIgnoreCase(modality)) {
                tokens[0] += detail.path("tokenCount").asLong(0);
            } else if ("TEXT".equalsIgnoreCase(modality)) {
                tokens[1] += detail.path("tokenCount").asLong(0);
            }
            tokens[0] += detail.path("audioTokens").asLong(0);
            tokens[1] += detail.path("textTokens").asLong(0);
        }
        return tokens;
    }
}
