package me.go_gradually.voicelive.domain.session;

import java.time.Duration;
import java.time.Instant;

/**
 * 세션 타이머 판단 로직.
 * Priority: unanswered duration warning, then a fresh duration warning, then inactivity.
 */
public final class LifecycleTimeoutPolicy {
    private LifecycleTimeoutPolicy() {
    }

    public static LifecycleDecision decide(LifecycleSnapshot snapshot, LifecycleThresholds thresholds, Instant now) {
        if (snapshot == null || thresholds == null || now == null || !snapshot.phase().isSupervised()) {
            return LifecycleDecision.none();
        }
        Instant warnedAt = snapshot.durationWarnedAt();
        if (warnedAt != null) {
            if (elapsed(warnedAt, now).compareTo(thresholds.warningTimeout()) > 0) {
                return new LifecycleDecision(LifecycleAction.CLOSE_AFTER_WARNING, SessionStopReason.DURATION_TIMEOUT);
            }
            // 경고가 떠 있는 동안은 비활성 종료를 보류한다.
            return LifecycleDecision.none();
        }
        if (elapsed(snapshot.durationAnchor(), now).compareTo(thresholds.durationWarning()) > 0) {
            return new LifecycleDecision(LifecycleAction.SEND_DURATION_WARNING, null);
        }
        if (elapsed(snapshot.lastActivityAt(), now).compareTo(thresholds.inactivityTimeout()) > 0) {
            return new LifecycleDecision(LifecycleAction.CLOSE_INACTIVE, SessionStopReason.INACTIVITY_TIMEOUT);
        }
        return LifecycleDecision.none();
    }

    private static Duration elapsed(Instant from, Instant now) {
        if (from == null) {
            return Duration.ZERO;
        }
        return Duration.between(from, now);
    }

    public enum LifecycleAction {
        NONE,
        SEND_DURATION_WARNING,
        CLOSE_AFTER_WARNING,
        CLOSE_INACTIVE
    }

    /**
     * @param durationAnchor session start, or the moment the user last answered a duration warning
     */
    public record LifecycleSnapshot(SessionPhase phase,
                                    Instant durationAnchor,
                                    Instant lastActivityAt,
                                    Instant durationWarnedAt) {
    }

    public record LifecycleThresholds(Duration durationWarning,
                                      Duration warningTimeout,
                                      Duration inactivityTimeout) {
        public LifecycleThresholds {
            if (durationWarning == null || warningTimeout == null || inactivityTimeout == null) {
                throw new IllegalArgumentException("Lifecycle thresholds are required");
            }
        }

        public static LifecycleThresholds ofSeconds(long durationWarning, long warningTimeout, long inactivityTimeout) {
            return new LifecycleThresholds(
                    Duration.ofSeconds(durationWarning),
                    Duration.ofSeconds(warningTimeout),
                    Duration.ofSeconds(inactivityTimeout)
            );
        }
    }

    public record LifecycleDecision(LifecycleAction action, SessionStopReason reason) {
        public static LifecycleDecision none() {
            return new LifecycleDecision(LifecycleAction.NONE, null);
        }

        public boolean closes() {
            return action == LifecycleAction.CLOSE_AFTER_WARNING || action == LifecycleAction.CLOSE_INACTIVE;
        }
    }
}
