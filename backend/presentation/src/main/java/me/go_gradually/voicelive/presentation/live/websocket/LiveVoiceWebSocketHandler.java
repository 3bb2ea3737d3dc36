package me.go_gradually.voicelive.presentation.live.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.live.model.LiveEventSink;
import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.model.StartSessionCommand;
import me.go_gradually.voicelive.application.live.usecase.LiveVoiceUseCase;
import me.go_gradually.voicelive.application.shared.error.ClientErrorFormatter;
import me.go_gradually.voicelive.application.shared.error.UnknownSessionException;
import me.go_gradually.voicelive.application.shared.error.VoiceLiveException;
import me.go_gradually.voicelive.domain.interruption.InterruptionEvent;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.session.SessionStopReason;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * One client connection per live session. Text frames carry tagged control messages,
 * binary frames carry raw PCM audio.
 */
@Component
public class LiveVoiceWebSocketHandler extends AbstractWebSocketHandler {
    static final int MESSAGE_SIZE_LIMIT = 1_048_576;
    private static final Logger log = Logger.getLogger(LiveVoiceWebSocketHandler.class.getName());

    private final LiveVoiceUseCase liveVoiceUseCase;
    private final ClientErrorFormatter errorFormatter;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, WebSocketSession> socketById = new ConcurrentHashMap<>();
    private final Map<String, LiveSession> sessionBySocketId = new ConcurrentHashMap<>();

    public LiveVoiceWebSocketHandler(LiveVoiceUseCase liveVoiceUseCase, ClientErrorFormatter errorFormatter, Clock clock) {
        this.liveVoiceUseCase = liveVoiceUseCase;
        this.errorFormatter = errorFormatter;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) {
        rawSession.setTextMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        rawSession.setBinaryMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        socketById.put(rawSession.getId(), new ConcurrentWebSocketSessionDecorator(rawSession, 10_000, MESSAGE_SIZE_LIMIT));
    }

    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) throws Exception {
        WebSocketSession socket = socketOf(rawSession);
        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(socket, new IllegalArgumentException("Message is not valid JSON", e));
            return;
        }
        String type = root.path("type").asText("");
        try {
            dispatch(socket, type, root);
        } catch (RuntimeException e) {
            handleFailure(socket, type, e);
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession rawSession, BinaryMessage message) throws Exception {
        WebSocketSession socket = socketOf(rawSession);
        try {
            liveVoiceUseCase.appendAudio(requireSession(socket), toBytes(message.getPayload()));
        } catch (RuntimeException e) {
            handleFailure(socket, "binary_audio", e);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession rawSession, Throwable exception) {
        log.warning("live.ws.transport_error socketId=" + rawSession.getId()
                + " message=" + (exception == null ? "" : exception.getMessage()));
        release(rawSession.getId(), SessionStopReason.TRANSPORT_CLOSED);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession rawSession, CloseStatus status) {
        log.fine(() -> "live.ws.closed socketId=" + rawSession.getId() + " status=" + status.getCode());
        release(rawSession.getId(), SessionStopReason.TRANSPORT_CLOSED);
    }

    private void dispatch(WebSocketSession socket, String type, JsonNode root) {
        // 필드는 최상위 또는 data 객체 안에 올 수 있다.
        JsonNode data = root.path("data").isObject() ? root.path("data") : root;
        switch (type) {
            case "start_session" -> startSession(socket, data);
            case "audio_chunk" -> liveVoiceUseCase.appendBase64Audio(requireSession(socket), audioField(root, data));
            case "turn_complete" -> liveVoiceUseCase.completeTurn(requireSession(socket));
            case "interruption" -> liveVoiceUseCase.recordInterruption(requireSession(socket), toInterruption(root, data));
            case "end_session" -> {
                LiveSession session = requireSession(socket);
                sessionBySocketId.remove(socket.getId());
                liveVoiceUseCase.end(session);
            }
            case "ping" -> sendEvent(socket, "pong", Map.of("timestamp", clock.millis()));
            default -> throw new IllegalArgumentException("Unsupported message type: " + type);
        }
    }

    private void startSession(WebSocketSession socket, JsonNode data) {
        // 서버가 먼저 닫은 세션(타임아웃 등)은 새 세션으로 교체할 수 있다.
        LiveSession existing = sessionBySocketId.get(socket.getId());
        if (existing != null && !existing.isClosed()) {
            throw new IllegalArgumentException("Session already started on this connection");
        }
        StartSessionCommand command = new StartSessionCommand();
        command.setLanguage(readString(data, "language"));
        command.setSystemInstruction(readString(data, "systemInstruction"));
        command.setUserId(readString(data, "userId"));
        command.setMode(readString(data, "mode"));
        LiveSession session = liveVoiceUseCase.start(command, new SocketEventSink(socket));
        sessionBySocketId.put(socket.getId(), session);
    }

    // 최상위 "type"은 메시지 종류이므로, 평탄한 형식에서는 interruptionType을 쓴다.
    private InterruptionEvent toInterruption(JsonNode root, JsonNode data) {
        String typeCode = data == root ? readString(root, "interruptionType") : readString(data, "type");
        return new InterruptionEvent(
                InterruptionType.fromCode(typeCode),
                data.path("progress").asDouble(0.0),
                readString(data, "partialText"),
                data.path("confidence").asDouble(1.0),
                data.path("intensity").asDouble(0.0),
                clock.instant()
        );
    }

    private LiveSession requireSession(WebSocketSession socket) {
        LiveSession session = sessionBySocketId.get(socket.getId());
        if (session == null || session.isClosed()) {
            throw new UnknownSessionException("No active session on connection " + socket.getId());
        }
        return session;
    }

    private void handleFailure(WebSocketSession socket, String type, RuntimeException error) {
        log.warning("live.ws.message_failed socketId=" + socket.getId() + " type=" + type
                + " code=" + ClientErrorFormatter.codeOf(error) + " message=" + error.getMessage());
        sendError(socket, error);
        if (error instanceof VoiceLiveException voiceLiveException && voiceLiveException.isFatal()) {
            try {
                socket.close(CloseStatus.SERVER_ERROR.withReason(voiceLiveException.code()));
            } catch (Exception e) {
                log.fine(() -> "live.ws.close_failed socketId=" + socket.getId());
            }
        }
    }

    private void release(String socketId, SessionStopReason reason) {
        socketById.remove(socketId);
        LiveSession session = sessionBySocketId.remove(socketId);
        if (session != null) {
            liveVoiceUseCase.closeSession(session, reason);
        }
    }

    private WebSocketSession socketOf(WebSocketSession rawSession) {
        return socketById.computeIfAbsent(rawSession.getId(),
                id -> new ConcurrentWebSocketSessionDecorator(rawSession, 10_000, MESSAGE_SIZE_LIMIT));
    }

    private void sendError(WebSocketSession socket, Throwable error) {
        sendEvent(socket, "error", errorFormatter.format(error));
    }

    private boolean sendEvent(WebSocketSession socket, String type, Map<String, Object> payload) {
        if (!socket.isOpen()) {
            return false;
        }
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("type", type);
            if (payload != null) {
                payload.forEach(envelope::putIfAbsent);
            }
            socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
            return true;
        } catch (Exception e) {
            log.fine(() -> "live.ws.send_failed socketId=" + socket.getId() + " type=" + type + " message=" + e.getMessage());
            return false;
        }
    }

    private boolean sendBinary(WebSocketSession socket, byte[] audio) {
        if (!socket.isOpen()) {
            return false;
        }
        try {
            socket.sendMessage(new BinaryMessage(audio));
            return true;
        } catch (Exception e) {
            log.fine(() -> "live.ws.audio_send_failed socketId=" + socket.getId() + " message=" + e.getMessage());
            return false;
        }
    }

    private static String audioField(JsonNode root, JsonNode data) {
        String audio = readString(data, "audio");
        return audio != null ? audio : readString(root, "data");
    }

    private static String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private final class SocketEventSink implements LiveEventSink {
        private final WebSocketSession socket;

        private SocketEventSink(WebSocketSession socket) {
            this.socket = socket;
        }

        @Override
        public boolean sendEvent(String type, Map<String, Object> payload) {
            return LiveVoiceWebSocketHandler.this.sendEvent(socket, type, payload);
        }

        @Override
        public boolean sendAudio(byte[] audio) {
            return sendBinary(socket, audio);
        }
    }
}
