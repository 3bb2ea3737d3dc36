package me.go_gradually.voicelive.application.live.model;

import java.util.Locale;

public enum SessionMode {
    NATIVE,
    PIPELINE;

    public static SessionMode fromCode(String code, SessionMode fallback) {
        if (code == null || code.isBlank()) {
            return fallback;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "pipeline" -> PIPELINE;
            case "native" -> NATIVE;
            default -> throw new IllegalArgumentException("Unsupported session mode: " + code);
        };
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
