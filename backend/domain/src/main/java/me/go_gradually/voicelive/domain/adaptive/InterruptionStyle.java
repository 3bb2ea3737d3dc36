package me.go_gradually.voicelive.domain.adaptive;

import java.util.Locale;

public enum InterruptionStyle {
    NORMAL,
    URGENT,
    FREQUENT,
    CLARIFICATION_SEEKER;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
