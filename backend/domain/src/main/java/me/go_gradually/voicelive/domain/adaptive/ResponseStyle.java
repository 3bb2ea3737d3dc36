package me.go_gradually.voicelive.domain.adaptive;

import java.util.Locale;

public enum ResponseStyle {
    CONCISE(100),
    DETAILED(300),
    SIMPLE(150),
    NORMAL(200);

    private final int maxTokens;

    ResponseStyle(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int maxTokens() {
        return maxTokens;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
