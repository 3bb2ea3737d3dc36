package me.go_gradually.voicelive.application.live.model;

import me.go_gradually.voicelive.application.history.model.HistoryMessage;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.domain.adaptive.AdaptiveProfileManager;
import me.go_gradually.voicelive.domain.audio.AudioAccumulator;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionContextStore;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.live.UsageCounters;
import me.go_gradually.voicelive.domain.session.LifecycleTimeoutPolicy.LifecycleSnapshot;
import me.go_gradually.voicelive.domain.session.SessionId;
import me.go_gradually.voicelive.domain.session.SessionPhase;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * State of one live conversation. Sub-objects are owned by this session and never shared.
 */
public class LiveSession {
    private static final Logger log = Logger.getLogger(LiveSession.class.getName());

    private final SessionId id;
    private final String userId;
    private final String language;
    private final SessionMode mode;
    private final LiveEventSink sink;
    private final Instant createdAt;
    private final InterruptionContextStore interruptions;
    private final AdaptiveProfileManager adaptive;
    private final AudioAccumulator audioBuffer;
    private final UsageCounters usage = new UsageCounters();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean pipelineRunning = new AtomicBoolean(false);
    private final Deque<byte[]> pendingUnits = new ArrayDeque<>();
    private final StringBuilder responseText = new StringBuilder();
    private final List<HistoryMessage> history = new ArrayList<>();

    private SessionPhase phase = SessionPhase.CONNECTING;
    private Instant lastActivityAt;
    private Instant durationAnchor;
    private Instant durationWarnedAt;
    private Instant turnStartedAt;
    private Instant lastConsumedInterruptionAt;
    private Instant lastAnsweredInterruptionAt;
    private boolean firstAudioSeen;
    private long lastLatencyMs;
    private String systemInstruction;
    private String lastAiResponse = "";
    private volatile UpstreamChannel channel;

    public LiveSession(SessionId id,
                       String userId,
                       String language,
                       SessionMode mode,
                       String systemInstruction,
                       LiveEventSink sink,
                       InterruptionContextStore interruptions,
                       AdaptiveProfileManager adaptive,
                       AudioAccumulator audioBuffer,
                       Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.language = language;
        this.mode = mode;
        this.systemInstruction = systemInstruction;
        this.sink = sink;
        this.interruptions = interruptions;
        this.adaptive = adaptive;
        this.audioBuffer = audioBuffer;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
        this.durationAnchor = createdAt;
    }

    public SessionId id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String language() {
        return language;
    }

    public SessionMode mode() {
        return mode;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public InterruptionContextStore interruptions() {
        return interruptions;
    }

    public AdaptiveProfileManager adaptive() {
        return adaptive;
    }

    public AudioAccumulator audioBuffer() {
        return audioBuffer;
    }

    public UsageCounters usage() {
        return usage;
    }

    public UpstreamChannel channel() {
        return channel;
    }

    public void attachChannel(UpstreamChannel channel) {
        this.channel = channel;
    }

    public synchronized SessionPhase phase() {
        return phase;
    }

    /**
     * Moves to the given phase unless the session is already closing.
     */
    public synchronized boolean transition(SessionPhase next) {
        if (phase.isTerminal()) {
            return false;
        }
        phase = next;
        return true;
    }

    public synchronized boolean isPriming() {
        return phase == SessionPhase.PRIMING;
    }

    public synchronized boolean acceptsClientAudio() {
        return phase == SessionPhase.ACTIVE || phase == SessionPhase.DURATION_WARNED;
    }

    public synchronized String systemInstruction() {
        return systemInstruction;
    }

    public synchronized void appendToSystemInstruction(String addition) {
        if (addition == null || addition.isBlank()) {
            return;
        }
        systemInstruction = systemInstruction == null || systemInstruction.isBlank()
                ? addition
                : systemInstruction + "\n\n" + addition;
    }

    /**
     * Upstream traffic only proves the connection is alive.
     */
    public synchronized void touch(Instant now) {
        lastActivityAt = now;
    }

    /**
     * Client traffic also answers a pending duration warning.
     *
     * @return true if a duration warning was cleared
     */
    public synchronized boolean acknowledgeUserActivity(Instant now) {
        lastActivityAt = now;
        if (phase != SessionPhase.DURATION_WARNED) {
            return false;
        }
        phase = SessionPhase.ACTIVE;
        durationWarnedAt = null;
        durationAnchor = now;
        return true;
    }

    public synchronized boolean markDurationWarned(Instant now) {
        if (phase != SessionPhase.ACTIVE) {
            return false;
        }
        phase = SessionPhase.DURATION_WARNED;
        durationWarnedAt = now;
        return true;
    }

    public synchronized boolean isDurationWarningSet() {
        return durationWarnedAt != null;
    }

    public synchronized LifecycleSnapshot lifecycleSnapshot() {
        return new LifecycleSnapshot(phase, durationAnchor, lastActivityAt, durationWarnedAt);
    }

    public synchronized Instant lastActivityAt() {
        return lastActivityAt;
    }

    /**
     * Starts the graceful close path once.
     */
    public synchronized boolean beginClosing() {
        if (phase.isTerminal()) {
            return false;
        }
        phase = SessionPhase.CLOSING;
        return true;
    }

    /**
     * @return true only for the call that actually closed the session
     */
    public boolean markClosed() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        synchronized (this) {
            phase = SessionPhase.CLOSED;
            pendingUnits.clear();
            responseText.setLength(0);
        }
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public synchronized void startTurn(Instant now) {
        if (turnStartedAt == null) {
            turnStartedAt = now;
            firstAudioSeen = false;
        }
    }

    /**
     * Returns the latency from the first user frame of the turn, only for the first reply chunk.
     */
    public synchronized Optional<Duration> markFirstAudio(Instant now) {
        if (firstAudioSeen || turnStartedAt == null) {
            return Optional.empty();
        }
        firstAudioSeen = true;
        Duration latency = Duration.between(turnStartedAt, now);
        lastLatencyMs = latency.toMillis();
        return Optional.of(latency);
    }

    public synchronized long lastLatencyMs() {
        return lastLatencyMs;
    }

    public synchronized void appendResponseText(String text) {
        if (text != null) {
            responseText.append(text);
        }
    }

    public synchronized String currentResponseText() {
        return responseText.toString();
    }

    /**
     * Finishes the current turn and returns the reply text it produced.
     */
    public synchronized String completeTurn() {
        String text = responseText.toString().trim();
        responseText.setLength(0);
        turnStartedAt = null;
        if (!text.isEmpty()) {
            lastAiResponse = text;
        }
        usage.countTurn();
        return text;
    }

    public synchronized void discardResponse() {
        responseText.setLength(0);
    }

    public synchronized String lastAiResponse() {
        return lastAiResponse;
    }

    public synchronized void recordAiResponse(String text) {
        if (text != null && !text.isBlank()) {
            lastAiResponse = text;
        }
    }

    /**
     * Returns the newest resumable interruption that no reply has used yet, and marks it used.
     */
    public synchronized InterruptionContext consumeResumableInterruption() {
        InterruptionContext context = interruptions.lastInterruptibleContext();
        if (context == null) {
            return null;
        }
        if (lastConsumedInterruptionAt != null && !context.timestamp().isAfter(lastConsumedInterruptionAt)) {
            return null;
        }
        lastConsumedInterruptionAt = context.timestamp();
        return context;
    }

    /**
     * Type of the newest interruption not yet answered, resumable or not. Each one is returned once.
     */
    public synchronized InterruptionType consumeLatestInterruption() {
        InterruptionContext latest = interruptions.latest();
        if (latest == null) {
            return null;
        }
        if (lastAnsweredInterruptionAt != null && !latest.timestamp().isAfter(lastAnsweredInterruptionAt)) {
            return null;
        }
        lastAnsweredInterruptionAt = latest.timestamp();
        return latest.type();
    }

    public synchronized void loadHistory(List<HistoryMessage> messages) {
        history.clear();
        if (messages != null) {
            history.addAll(messages);
        }
    }

    public synchronized void appendHistory(HistoryMessage message) {
        history.add(message);
    }

    public synchronized List<HistoryMessage> history() {
        return List.copyOf(history);
    }

    /**
     * Queues one transcription unit.
     *
     * @return false if the queue is full and the unit was dropped
     */
    public synchronized boolean enqueuePipelineUnit(byte[] unit, int maxPending) {
        if (closed.get()) {
            return false;
        }
        if (pendingUnits.size() >= maxPending) {
            return false;
        }
        pendingUnits.addLast(unit);
        return true;
    }

    public synchronized byte[] pollPipelineUnit() {
        return pendingUnits.pollFirst();
    }

    public synchronized boolean hasPendingPipelineUnits() {
        return !pendingUnits.isEmpty();
    }

    public boolean tryStartPipeline() {
        return pipelineRunning.compareAndSet(false, true);
    }

    public void finishPipeline() {
        pipelineRunning.set(false);
    }

    public boolean send(String type, Map<String, Object> payload) {
        if (closed.get() && !"session_ended".equals(type)) {
            return false;
        }
        try {
            boolean sent = sink.sendEvent(type, payload);
            if (!sent) {
                log.fine(() -> "live.session.send_failed sessionId=" + id.value() + " type=" + type);
            }
            return sent;
        } catch (RuntimeException e) {
            log.warning("live.session.send_error sessionId=" + id.value() + " type=" + type + " message=" + e.getMessage());
            return false;
        }
    }

    public boolean sendAudio(byte[] audio) {
        if (closed.get() || audio == null || audio.length == 0) {
            return false;
        }
        try {
            return sink.sendAudio(audio);
        } catch (RuntimeException e) {
            log.warning("live.session.audio_send_error sessionId=" + id.value() + " message=" + e.getMessage());
            return false;
        }
    }
}
