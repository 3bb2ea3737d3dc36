package me.go_gradually.voicelive.domain.interruption;

import java.time.Instant;

public record InterruptionEvent(InterruptionType type,
                                double progress,
                                String partialText,
                                double confidence,
                                double intensity,
                                Instant occurredAt) {
    public InterruptionEvent {
        if (type == null) {
            throw new IllegalArgumentException("Interruption type is required");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("Interruption time is required");
        }
        progress = clamp(progress);
        partialText = partialText == null ? "" : partialText;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
