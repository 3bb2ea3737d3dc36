package me.go_gradually.voicelive.domain.adaptive;

import java.time.Duration;

public record AdaptiveSettings(Duration window, int sampleCap, Duration directiveTtl) {
    public AdaptiveSettings {
        if (window == null || directiveTtl == null) {
            throw new IllegalArgumentException("window and directiveTtl are required");
        }
        if (sampleCap <= 0) {
            throw new IllegalArgumentException("sampleCap must be positive");
        }
    }

    public static AdaptiveSettings defaults() {
        return new AdaptiveSettings(Duration.ofMinutes(5), 10, Duration.ofMinutes(5));
    }
}
