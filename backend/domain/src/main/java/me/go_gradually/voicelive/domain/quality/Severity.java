package me.go_gradually.voicelive.domain.quality;

import java.util.Locale;

public enum Severity {
    CRITICAL(0.15, 0.4),
    HIGH(0.10, 0.3),
    MEDIUM(0.05, 0.2),
    LOW(0.02, 0.1);

    private final double frustrationWeight;
    private final double qualityPenalty;

    Severity(double frustrationWeight, double qualityPenalty) {
        this.frustrationWeight = frustrationWeight;
        this.qualityPenalty = qualityPenalty;
    }

    public double frustrationWeight() {
        return frustrationWeight;
    }

    public double qualityPenalty() {
        return qualityPenalty;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }
}
