package me.go_gradually.voicelive.domain.interruption;

public record InterruptionPattern(Frequency frequency, InterruptionType mostCommonType, Trend trend) {

    public static InterruptionPattern empty() {
        return new InterruptionPattern(Frequency.NONE, null, Trend.STABLE);
    }

    public enum Frequency {
        NONE,
        LOW,
        MEDIUM,
        HIGH
    }

    public enum Trend {
        INCREASING,
        DECREASING,
        STABLE
    }
}
