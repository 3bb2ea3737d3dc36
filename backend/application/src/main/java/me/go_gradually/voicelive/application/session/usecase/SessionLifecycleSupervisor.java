package me.go_gradually.voicelive.application.session.usecase;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.application.session.policy.LifecyclePolicy;
import me.go_gradually.voicelive.application.session.port.LiveSessionRegistry;
import me.go_gradually.voicelive.application.shared.port.DelayScheduler;
import me.go_gradually.voicelive.domain.session.LifecycleTimeoutPolicy;
import me.go_gradually.voicelive.domain.session.LifecycleTimeoutPolicy.LifecycleDecision;
import me.go_gradually.voicelive.domain.session.LifecycleTimeoutPolicy.LifecycleThresholds;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;
import me.go_gradually.voicelive.domain.session.SessionStopReason;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Single periodic check over all registered sessions. Each {@link #tick()} applies at most one timeout action per session.
 */
public class SessionLifecycleSupervisor {
    private static final Logger log = Logger.getLogger(SessionLifecycleSupervisor.class.getName());

    private final LiveSessionRegistry registry;
    private final LifecyclePolicy policy;
    private final DelayScheduler delayScheduler;
    private final SessionCloser closer;
    private final Clock clock;

    public SessionLifecycleSupervisor(LiveSessionRegistry registry,
                                      LifecyclePolicy policy,
                                      DelayScheduler delayScheduler,
                                      SessionCloser closer,
                                      Clock clock) {
        this.registry = registry;
        this.policy = policy;
        this.delayScheduler = delayScheduler;
        this.closer = closer;
        this.clock = clock;
    }

    public Duration checkInterval() {
        return Duration.ofSeconds(Math.max(1L, policy.checkIntervalSeconds()));
    }

    public void tick() {
        Instant now = clock.instant();
        LifecycleThresholds thresholds = LifecycleThresholds.ofSeconds(
                policy.durationWarningSeconds(),
                policy.warningTimeoutSeconds(),
                policy.inactivityTimeoutSeconds()
        );
        for (LiveSession session : List.copyOf(registry.all())) {
            try {
                check(session, thresholds, now);
            } catch (RuntimeException e) {
                log.warning("lifecycle.check_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
            }
        }
    }

    private void check(LiveSession session, LifecycleThresholds thresholds, Instant now) {
        if (session.isClosed()) {
            registry.remove(session.id());
            return;
        }
        LifecycleDecision decision = LifecycleTimeoutPolicy.decide(session.lifecycleSnapshot(), thresholds, now);
        switch (decision.action()) {
            case SEND_DURATION_WARNING -> warn(session, now);
            case CLOSE_AFTER_WARNING, CLOSE_INACTIVE -> closeGracefully(session, decision.reason());
            case NONE -> {
            }
        }
    }

    private void warn(LiveSession session, Instant now) {
        if (!session.markDurationWarned(now)) {
            return;
        }
        log.info(() -> "lifecycle.duration_warning sessionId=" + session.id().value());
        speak(session, LocalizedPrompts.durationWarning(session.language()));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.id().value());
        payload.put("kind", "duration");
        session.send("session_warning", payload);
    }

    private void closeGracefully(LiveSession session, SessionStopReason reason) {
        if (!session.beginClosing()) {
            return;
        }
        log.info(() -> "lifecycle.timeout sessionId=" + session.id().value() + " reason=" + reason.code());
        speak(session, LocalizedPrompts.goodbye(reason, session.language()));
        // 작별 인사 오디오가 흘러갈 시간을 준 뒤 닫는다.
        delayScheduler.schedule(() -> closer.close(session, reason), Duration.ofMillis(policy.closeGraceMs()));
    }

    private void speak(LiveSession session, String text) {
        UpstreamChannel channel = session.channel();
        if (channel == null || !channel.isOpen()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sessionId", session.id().value());
            payload.put("text", text);
            session.send("text_response", payload);
            return;
        }
        try {
            channel.sendModelText(text);
        } catch (RuntimeException e) {
            log.warning("lifecycle.prompt_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
        }
    }
}
