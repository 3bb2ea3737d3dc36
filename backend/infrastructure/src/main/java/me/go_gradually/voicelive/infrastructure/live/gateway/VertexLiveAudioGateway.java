package me.go_gradually.voicelive.infrastructure.live.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.live.model.UpstreamOpenCommand;
import me.go_gradually.voicelive.application.live.model.UpstreamSetup;
import me.go_gradually.voicelive.application.live.port.UpstreamAudioGateway;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.application.live.port.UpstreamEventListener;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Bidirectional live audio over the Vertex AI BidiGenerateContent websocket.
 */
@Component
public class VertexLiveAudioGateway implements UpstreamAudioGateway {
    private static final Logger log = Logger.getLogger(VertexLiveAudioGateway.class.getName());
    private static final String LIVE_PATH = "/ws/google.cloud.aiplatform.v1beta1.LlmBidiService/BidiGenerateContent";
    private static final String INPUT_MIME_TYPE = "audio/pcm;rate=";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final URI endpoint;
    private final String accessToken;
    private final int sampleRate;
    private final LiveSetupMessageFactory setupFactory;

    public VertexLiveAudioGateway(AppProperties properties) {
        this(properties, toLiveUri(properties.getUpstream()));
    }

    VertexLiveAudioGateway(AppProperties properties, URI endpoint) {
        AppProperties.Upstream upstream = properties.getUpstream();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(upstream.getConnectTimeoutMs()))
                .build();
        this.endpoint = endpoint;
        this.accessToken = upstream.getAccessToken();
        this.sampleRate = properties.getPipeline().getSampleRate();
        this.setupFactory = new LiveSetupMessageFactory(objectMapper,
                upstream.getProjectId(), upstream.getLocation(), upstream.getModel());
    }

    @Override
    public CompletableFuture<UpstreamChannel> connect(UpstreamOpenCommand command, UpstreamEventListener listener) {
        CompletableFuture<Void> setupAcknowledged = new CompletableFuture<>();
        LiveWebSocketListener webSocketListener = new LiveWebSocketListener(command.sessionId(),
                new LiveServerMessageReader(objectMapper, listener, setupAcknowledged), listener, setupAcknowledged);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        log.fine(() -> "live.gateway.connecting sessionId=" + command.sessionId() + " host=" + endpoint.getHost());
        return builder.buildAsync(endpoint, webSocketListener)
                .thenApply(webSocket -> new LiveChannel(command.sessionId(), webSocket, setupAcknowledged));
    }

    static URI toLiveUri(AppProperties.Upstream upstream) {
        String baseUrl = upstream.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "wss://" + upstream.getLocation() + "-aiplatform.googleapis.com";
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        try {
            return URI.create(baseUrl + LIVE_PATH);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid live base URL: " + baseUrl, e);
        }
    }

    private final class LiveChannel implements UpstreamChannel {
        private final String sessionId;
        private final WebSocket webSocket;
        private final CompletableFuture<Void> setupAcknowledged;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private LiveChannel(String sessionId, WebSocket webSocket, CompletableFuture<Void> setupAcknowledged) {
            this.sessionId = sessionId;
            this.webSocket = webSocket;
            this.setupAcknowledged = setupAcknowledged;
        }

        @Override
        public CompletableFuture<Void> setup(UpstreamSetup setup) {
            try {
                sendRaw(setupFactory.create(setup));
            } catch (Exception e) {
                setupAcknowledged.completeExceptionally(e);
            }
            return setupAcknowledged;
        }

        @Override
        public void sendAudio(byte[] frame) {
            if (closed.get()) {
                return;
            }
            send(Map.of("realtimeInput", Map.of(
                    "mediaChunks", List.of(Map.of(
                            "mimeType", INPUT_MIME_TYPE + sampleRate,
                            "data", Base64.getEncoder().encodeToString(frame)
                    ))
            )));
        }

        @Override
        public void sendTurnComplete() {
            if (closed.get()) {
                return;
            }
            send(Map.of("clientContent", Map.of("turnComplete", true)));
        }

        @Override
        public void sendModelText(String text) {
            sendTurn("model", text);
        }

        @Override
        public void sendUserText(String text) {
            sendTurn("user", text);
        }

        @Override
        public void sendToolResponse(String callId, String name, String result) {
            if (closed.get()) {
                return;
            }
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("id", callId);
            response.put("name", name);
            response.put("response", Map.of("result", result));
            send(Map.of("toolResponse", Map.of("functionResponses", List.of(response))));
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !webSocket.isOutputClosed();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            setupAcknowledged.cancel(false);
            try {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "session ended").join();
            } catch (Exception e) {
                log.fine(() -> "live.gateway.close_failed sessionId=" + sessionId + " error=" + e.getMessage());
                webSocket.abort();
            }
        }

        private void sendTurn(String role, String text) {
            if (closed.get() || text == null || text.isBlank()) {
                return;
            }
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("turns", List.of(Map.of("role", role, "parts", List.of(Map.of("text", text)))));
            content.put("turnComplete", true);
            send(Map.of("clientContent", content));
        }

        private void send(Map<String, Object> payload) {
            String text;
            try {
                text = objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to encode live message", e);
            }
            sendRaw(text);
        }

        // WebSocket은 이전 전송이 끝나기 전에 다음 전송을 허용하지 않는다.
        private synchronized void sendRaw(String text) {
            try {
                webSocket.sendText(text, true).join();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to send live message", e);
            }
        }
    }

    private static final class LiveWebSocketListener implements WebSocket.Listener {
        private final String sessionId;
        private final LiveServerMessageReader reader;
        private final UpstreamEventListener listener;
        private final CompletableFuture<Void> setupAcknowledged;
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();

        private LiveWebSocketListener(String sessionId,
                                      LiveServerMessageReader reader,
                                      UpstreamEventListener listener,
                                      CompletableFuture<Void> setupAcknowledged) {
            this.sessionId = sessionId;
            this.reader = reader;
            this.listener = listener;
            this.setupAcknowledged = setupAcknowledged;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                reader.read(payload);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        // 서버는 JSON을 바이너리 프레임으로 보내기도 한다.
        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binaryBuffer.write(chunk, 0, chunk.length);
            if (last) {
                String payload = binaryBuffer.toString(StandardCharsets.UTF_8);
                binaryBuffer.reset();
                reader.read(payload);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info(() -> "live.gateway.closed sessionId=" + sessionId + " status=" + statusCode + " reason=" + reason);
            setupAcknowledged.completeExceptionally(
                    new IllegalStateException("Live connection closed before setup: " + statusCode + " " + reason));
            listener.onClosed(statusCode, reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warning("live.gateway.error sessionId=" + sessionId + " error=" + (error == null ? "unknown" : error.getMessage()));
            Throwable cause = error == null ? new IllegalStateException("Live websocket error") : error;
            setupAcknowledged.completeExceptionally(cause);
            listener.onError(cause);
        }
    }
}
