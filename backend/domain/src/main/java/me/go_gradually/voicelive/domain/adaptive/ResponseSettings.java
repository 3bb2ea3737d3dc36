package me.go_gradually.voicelive.domain.adaptive;

public record ResponseSettings(ResponseStyle style, int maxWords) {
    public ResponseSettings {
        if (style == null) {
            throw new IllegalArgumentException("style is required");
        }
        if (maxWords <= 0) {
            throw new IllegalArgumentException("maxWords must be positive");
        }
    }

    public static ResponseSettings normal() {
        return new ResponseSettings(ResponseStyle.NORMAL, 100);
    }

    public int maxTokens() {
        return style.maxTokens();
    }
}
