package me.go_gradually.voicelive.application.live.usecase;

import me.go_gradually.voicelive.application.audio.port.AudioFrameTransform;
import me.go_gradually.voicelive.application.conversation.policy.ConversationPolicy;
import me.go_gradually.voicelive.application.history.model.HistoryMessage;
import me.go_gradually.voicelive.application.history.port.ConversationHistoryPort;
import me.go_gradually.voicelive.application.live.model.LiveEventSink;
import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.model.LiveTurnListener;
import me.go_gradually.voicelive.application.live.model.SessionMode;
import me.go_gradually.voicelive.application.live.model.StartSessionCommand;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.application.pipeline.model.PipelineResult;
import me.go_gradually.voicelive.application.pipeline.policy.PipelinePolicy;
import me.go_gradually.voicelive.application.pipeline.usecase.AudioPipelineOrchestrator;
import me.go_gradually.voicelive.application.session.port.LiveSessionRegistry;
import me.go_gradually.voicelive.application.shared.error.ClientErrorFormatter;
import me.go_gradually.voicelive.application.shared.error.UnknownSessionException;
import me.go_gradually.voicelive.application.shared.error.UpstreamSetupException;
import me.go_gradually.voicelive.application.shared.error.VoiceLiveException;
import me.go_gradually.voicelive.application.shared.port.AsyncExecutor;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.application.tracing.port.TracingPort;
import me.go_gradually.voicelive.domain.adaptive.AdaptationDirective;
import me.go_gradually.voicelive.domain.adaptive.AdaptiveProfileManager;
import me.go_gradually.voicelive.domain.adaptive.AdaptiveSettings;
import me.go_gradually.voicelive.domain.audio.AudioAccumulator;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionContextStore;
import me.go_gradually.voicelive.domain.interruption.InterruptionEvent;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.live.UsageCounters.UsageReport;
import me.go_gradually.voicelive.domain.session.SessionId;
import me.go_gradually.voicelive.domain.session.SessionPhase;
import me.go_gradually.voicelive.domain.session.SessionStopReason;
import me.go_gradually.voicelive.domain.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Client-facing operations of a live voice session and the callbacks the upstream channel drives.
 */
public class LiveVoiceUseCase implements LiveTurnListener {
    static final String DEFAULT_LANGUAGE = "en";
    static final int MAX_STORED_MESSAGES = 100;
    // 네이티브 모드에는 사용자 전사가 없어 자리표시자로 남긴다.
    static final String USER_AUDIO_MARKER = "[audio]";
    private static final Logger log = Logger.getLogger(LiveVoiceUseCase.class.getName());

    private final LiveSessionRegistry registry;
    private final UpstreamConnectionManager connectionManager;
    private final AudioPipelineOrchestrator pipeline;
    private final AudioFrameTransform frameTransform;
    private final ConversationHistoryPort historyPort;
    private final TracingPort tracing;
    private final AsyncExecutor asyncExecutor;
    private final ConversationPolicy conversationPolicy;
    private final PipelinePolicy pipelinePolicy;
    private final ClientErrorFormatter errorFormatter;
    private final MetricsPort metrics;
    private final Clock clock;

    public LiveVoiceUseCase(LiveSessionRegistry registry,
                            UpstreamConnectionManager connectionManager,
                            AudioPipelineOrchestrator pipeline,
                            AudioFrameTransform frameTransform,
                            ConversationHistoryPort historyPort,
                            TracingPort tracing,
                            AsyncExecutor asyncExecutor,
                            ConversationPolicy conversationPolicy,
                            PipelinePolicy pipelinePolicy,
                            ClientErrorFormatter errorFormatter,
                            MetricsPort metrics,
                            Clock clock) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.pipeline = pipeline;
        this.frameTransform = frameTransform;
        this.historyPort = historyPort;
        this.tracing = tracing;
        this.asyncExecutor = asyncExecutor;
        this.conversationPolicy = conversationPolicy;
        this.pipelinePolicy = pipelinePolicy;
        this.errorFormatter = errorFormatter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a new session and establishes it in the background.
     * The caller gets the session immediately; {@code session_ready} follows once audio is accepted.
     */
    public LiveSession start(StartSessionCommand command, LiveEventSink sink) {
        if (command == null) {
            throw new IllegalArgumentException("start_session payload is required");
        }
        SessionMode fallbackMode = pipelinePolicy.nativeModeByDefault() ? SessionMode.NATIVE : SessionMode.PIPELINE;
        SessionMode mode = SessionMode.fromCode(command.getMode(), fallbackMode);
        String language = TextUtils.isBlank(command.getLanguage()) ? DEFAULT_LANGUAGE : command.getLanguage().trim();
        Instant now = clock.instant();

        LiveSession session = new LiveSession(
                SessionId.random(),
                TextUtils.isBlank(command.getUserId()) ? null : command.getUserId().trim(),
                language,
                mode,
                command.getSystemInstruction(),
                sink,
                new InterruptionContextStore(conversationPolicy.interruptionStackCapacity()),
                new AdaptiveProfileManager(adaptiveSettings(), clock),
                new AudioAccumulator(Duration.ofMillis(pipelinePolicy.bufferDurationMs()), pipelinePolicy.bufferMaxBytes()),
                now
        );
        registry.register(session);
        metrics.incrementSessionOpened();
        log.info(() -> "live.session.started sessionId=" + session.id().value()
                + " mode=" + mode.code() + " language=" + language);
        session.send("session_started", sessionPayload(session));
        trace(session, "session_started", Map.of("mode", mode.code(), "language", language));

        asyncExecutor.execute(() -> establish(session));
        return session;
    }

    /**
     * Accepts one raw client frame. Frames arriving before the session is ready are dropped.
     */
    public void appendAudio(LiveSession session, byte[] rawFrame) {
        requireOpen(session);
        byte[] frame = frameTransform.toUpstreamFrame(rawFrame);
        if (!session.acceptsClientAudio()) {
            log.fine(() -> "live.audio.dropped sessionId=" + session.id().value() + " phase=" + session.phase());
            return;
        }
        Instant now = clock.instant();
        acknowledgeActivity(session, now);

        if (session.mode() == SessionMode.NATIVE) {
            UpstreamChannel channel = session.channel();
            if (channel == null || !channel.isOpen()) {
                log.fine(() -> "live.audio.no_channel sessionId=" + session.id().value());
                return;
            }
            session.startTurn(now);
            channel.sendAudio(frame);
            return;
        }
        session.audioBuffer().append(frame, now).ifPresent(unit -> enqueue(session, unit));
    }

    public void appendBase64Audio(LiveSession session, String base64Frame) {
        requireOpen(session);
        appendAudio(session, frameTransform.decodeBase64(base64Frame));
    }

    /**
     * Client says the user finished speaking.
     */
    public void completeTurn(LiveSession session) {
        requireOpen(session);
        acknowledgeActivity(session, clock.instant());
        if (session.mode() == SessionMode.NATIVE) {
            UpstreamChannel channel = session.channel();
            if (channel != null && channel.isOpen()) {
                channel.sendTurnComplete();
            }
            return;
        }
        byte[] remaining = session.audioBuffer().drain();
        if (remaining.length > 0) {
            enqueue(session, remaining);
        }
    }

    /**
     * Interruption reported by the client, e.g. from local voice activity detection.
     */
    public void recordInterruption(LiveSession session, InterruptionEvent event) {
        requireOpen(session);
        acknowledgeActivity(session, clock.instant());
        String interrupted = TextUtils.firstNonBlank(session.currentResponseText(), session.lastAiResponse());
        handleInterruption(session, event, interrupted);
    }

    public void end(LiveSession session) {
        closeSession(session, SessionStopReason.CLIENT_ENDED);
    }

    /**
     * Idempotent. Only the first call for a session releases anything or notifies the client.
     */
    public void closeSession(LiveSession session, SessionStopReason reason) {
        if (session == null || !session.markClosed()) {
            return;
        }
        String sessionId = session.id().value();
        registry.remove(session.id());
        UpstreamChannel channel = session.channel();
        if (channel != null) {
            try {
                channel.close();
            } catch (RuntimeException e) {
                log.warning("live.session.channel_close_failed sessionId=" + sessionId + " message=" + e.getMessage());
            }
        }
        session.audioBuffer().drain();
        session.interruptions().clear();

        Map<String, Object> payload = sessionPayload(session);
        payload.put("reason", reason.code());
        session.send("session_ended", payload);
        metrics.incrementSessionClosed();
        log.info(() -> "live.session.closed sessionId=" + sessionId + " reason=" + reason.code()
                + " turns=" + session.usage().turns());

        UsageReport usage = session.usage().snapshot();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("reason", reason.code());
        attributes.put("turns", session.usage().turns());
        attributes.put("totalTokens", usage.totalTokens());
        trace(session, "session_closed", attributes);
    }

    @Override
    public void onTurnComplete(LiveSession session) {
        if (session.isClosed()) {
            return;
        }
        String reply = session.completeTurn();
        long latencyMs = session.lastLatencyMs();
        if (!reply.isBlank()) {
            Map<String, Object> text = sessionPayload(session);
            text.put("text", reply);
            session.send("text_response", text);
            rememberExchange(session, USER_AUDIO_MARKER, reply);
        }
        Map<String, Object> payload = sessionPayload(session);
        payload.put("latencyMs", latencyMs);
        session.send("turn_complete", payload);
        trace(session, "turn_complete", Map.of("latencyMs", latencyMs, "chars", reply.length()));
        runAdaptation(session);
    }

    /**
     * Upstream cut its own reply short because the user spoke over it.
     */
    @Override
    public void onInterrupted(LiveSession session) {
        if (session.isClosed()) {
            return;
        }
        String partial = session.currentResponseText();
        int maxWords = Math.max(1, session.adaptive().responseSettings().maxWords());
        double progress = Math.min(1.0, TextUtils.wordCount(partial) / (double) maxWords);
        InterruptionEvent event = new InterruptionEvent(InterruptionType.BARGE_IN, progress, "", 1.0, 0.5, clock.instant());
        handleInterruption(session, event, partial);
        session.discardResponse();
    }

    @Override
    public void onUpstreamClosed(LiveSession session, String reason) {
        if (session.isClosed()) {
            return;
        }
        log.warning("live.upstream.closed sessionId=" + session.id().value() + " reason=" + reason);
        closeSession(session, SessionStopReason.UPSTREAM_CLOSED);
    }

    @Override
    public void onUpstreamError(LiveSession session, Throwable error) {
        if (session.isClosed()) {
            return;
        }
        log.warning("live.upstream.error sessionId=" + session.id().value() + " message=" + error.getMessage());
        sendError(session, error);
        UpstreamChannel channel = session.channel();
        if (channel != null && !channel.isOpen()) {
            closeSession(session, SessionStopReason.UPSTREAM_CLOSED);
        }
    }

    private void establish(LiveSession session) {
        loadHistory(session);
        try {
            if (session.mode() == SessionMode.NATIVE) {
                connectionManager.open(session, this);
            } else {
                session.transition(SessionPhase.ACTIVE);
            }
        } catch (VoiceLiveException e) {
            log.warning("live.session.establish_failed sessionId=" + session.id().value() + " code=" + e.code());
            sendError(session, e);
            closeSession(session, e instanceof UpstreamSetupException
                    ? SessionStopReason.SETUP_FAILED
                    : SessionStopReason.CONNECTION_FAILED);
            return;
        } catch (RuntimeException e) {
            log.warning("live.session.establish_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
            sendError(session, e);
            closeSession(session, SessionStopReason.CONNECTION_FAILED);
            return;
        }
        if (session.isClosed()) {
            // 연결 중에 클라이언트가 먼저 끊은 경우
            UpstreamChannel channel = session.channel();
            if (channel != null) {
                channel.close();
            }
            return;
        }
        session.touch(clock.instant());
        Map<String, Object> payload = sessionPayload(session);
        payload.put("language", session.language());
        payload.put("mode", session.mode().code());
        session.send("session_ready", payload);
    }

    private void loadHistory(LiveSession session) {
        if (session.userId() == null) {
            return;
        }
        try {
            List<HistoryMessage> stored = historyPort.getProfile(session.userId());
            if (stored == null || stored.isEmpty()) {
                return;
            }
            session.loadHistory(stored);
            int limit = Math.max(0, conversationPolicy.historyMessages());
            List<HistoryMessage> recent = stored.subList(Math.max(0, stored.size() - limit), stored.size());
            if (recent.isEmpty()) {
                return;
            }
            StringBuilder summary = new StringBuilder("Previous conversation with this user:");
            for (HistoryMessage message : recent) {
                summary.append('\n').append(message.role()).append(": ").append(message.text());
            }
            session.appendToSystemInstruction(summary.toString());
        } catch (Exception e) {
            log.warning("live.history.load_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
        }
    }

    private void rememberExchange(LiveSession session, String userText, String modelText) {
        if (session.userId() == null) {
            return;
        }
        Instant now = clock.instant();
        if (!TextUtils.isBlank(userText)) {
            session.appendHistory(new HistoryMessage(HistoryMessage.USER, userText, now));
        }
        session.appendHistory(new HistoryMessage(HistoryMessage.MODEL, modelText, now));
        List<HistoryMessage> history = session.history();
        // 최대 100개까지만 저장
        List<HistoryMessage> stored = history.subList(Math.max(0, history.size() - MAX_STORED_MESSAGES), history.size());
        asyncExecutor.execute(() -> {
            try {
                historyPort.saveProfile(session.userId(), stored);
            } catch (Exception e) {
                log.warning("live.history.save_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
            }
        });
    }

    private void enqueue(LiveSession session, byte[] unit) {
        if (!session.enqueuePipelineUnit(unit, Math.max(1, pipelinePolicy.maxPendingFlushes()))) {
            metrics.incrementDroppedFlush();
            log.warning("pipeline.flush_dropped sessionId=" + session.id().value() + " bytes=" + unit.length);
            return;
        }
        drainPipeline(session);
    }

    private void drainPipeline(LiveSession session) {
        if (!session.tryStartPipeline()) {
            return;
        }
        asyncExecutor.execute(() -> runPipeline(session));
    }

    private void runPipeline(LiveSession session) {
        try {
            byte[] unit;
            while (!session.isClosed() && (unit = session.pollPipelineUnit()) != null) {
                processUnit(session, unit);
            }
        } finally {
            session.finishPipeline();
        }
        if (!session.isClosed() && session.hasPendingPipelineUnits()) {
            drainPipeline(session);
        }
    }

    private void processUnit(LiveSession session, byte[] unit) {
        PipelineResult result;
        try {
            result = pipeline.processAudio(unit, session);
        } catch (RuntimeException e) {
            log.warning("pipeline.unit_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
            sendError(session, e);
            return;
        }
        session.completeTurn();

        Map<String, Object> text = sessionPayload(session);
        text.put("text", result.text());
        text.put("transcript", result.transcript());
        text.put("fallback", result.isFallback());
        if (result.isFallback()) {
            text.put("source", result.fallbackSource().code());
            text.put("action", result.action().name());
        }
        session.send("text_response", text);
        session.sendAudio(result.audio());

        Map<String, Object> done = sessionPayload(session);
        done.put("latencyMs", result.latency().totalMs());
        done.put("transcriptionMs", result.latency().transcriptionMs());
        done.put("generationMs", result.latency().generationMs());
        done.put("synthesisMs", result.latency().synthesisMs());
        session.send("turn_complete", done);

        if (!result.isFallback()) {
            rememberExchange(session, result.transcript(), result.text());
        }
        trace(session, "pipeline_turn", Map.of(
                "latencyMs", result.latency().totalMs(),
                "fallback", result.isFallback(),
                "issues", result.issues().size()));
        runAdaptation(session);
    }

    private void handleInterruption(LiveSession session, InterruptionEvent event, String interruptedText) {
        InterruptionContext context = session.interruptions().save(event, interruptedText);
        session.adaptive().recordInterruption(event);
        log.info(() -> "live.interruption sessionId=" + session.id().value() + " type=" + event.type()
                + " progress=" + event.progress() + " canResume=" + context.canResume());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("type", event.type().name());
        attributes.put("progress", event.progress());
        attributes.put("canResume", context.canResume());
        trace(session, "interruption", attributes);
        runAdaptation(session);
    }

    private void runAdaptation(LiveSession session) {
        List<AdaptationDirective> directives = session.adaptive().adapt();
        for (AdaptationDirective directive : directives) {
            log.info(() -> "live.adaptation sessionId=" + session.id().value() + " directive=" + directive);
            if (directive.isSilent()) {
                continue;
            }
            Map<String, Object> payload = sessionPayload(session);
            payload.put("directive", directive.name());
            payload.put("message", directive.userMessage());
            if (directive.parameter() > 0) {
                payload.put("parameter", directive.parameter());
            }
            session.send("adaptation", payload);
        }
    }

    private void acknowledgeActivity(LiveSession session, Instant now) {
        if (session.acknowledgeUserActivity(now)) {
            log.info(() -> "lifecycle.warning_cleared sessionId=" + session.id().value());
        }
    }

    private void sendError(LiveSession session, Throwable error) {
        Map<String, Object> payload = sessionPayload(session);
        payload.putAll(errorFormatter.format(error));
        session.send("error", payload);
    }

    private void trace(LiveSession session, String event, Map<String, Object> attributes) {
        try {
            tracing.logTrace(session.id().value(), event, attributes);
        } catch (RuntimeException e) {
            log.fine(() -> "live.trace_failed sessionId=" + session.id().value() + " event=" + event);
        }
    }

    private AdaptiveSettings adaptiveSettings() {
        return new AdaptiveSettings(
                Duration.ofSeconds(conversationPolicy.adaptiveWindowSeconds()),
                conversationPolicy.adaptiveSampleCap(),
                Duration.ofSeconds(conversationPolicy.directiveTtlSeconds())
        );
    }

    private static void requireOpen(LiveSession session) {
        if (session == null || session.isClosed()) {
            throw new UnknownSessionException("No active session");
        }
    }

    private static Map<String, Object> sessionPayload(LiveSession session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.id().value());
        return payload;
    }
}
