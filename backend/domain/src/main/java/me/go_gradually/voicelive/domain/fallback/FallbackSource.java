package me.go_gradually.voicelive.domain.fallback;

import java.util.Locale;

public enum FallbackSource {
    CACHE,
    LIBRARY,
    GENERATED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
