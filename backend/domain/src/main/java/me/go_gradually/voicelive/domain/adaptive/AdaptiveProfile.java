package me.go_gradually.voicelive.domain.adaptive;

import java.util.List;

/**
 * Read-only view of a session's adaptive state.
 */
public record AdaptiveProfile(NoiseEnvironment noiseEnvironment,
                              SpeechClarity speechClarity,
                              PauseFrequency pauseFrequency,
                              InterruptionStyle interruptionStyle,
                              double frustrationLevel,
                              int attemptCount,
                              int recentIssueCount,
                              int recentInterruptionCount,
                              List<ActiveDirective> activeDirectives) {
    public AdaptiveProfile {
        activeDirectives = activeDirectives == null ? List.of() : List.copyOf(activeDirectives);
    }
}
