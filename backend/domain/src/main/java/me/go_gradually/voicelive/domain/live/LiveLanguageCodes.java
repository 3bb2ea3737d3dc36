package me.go_gradually.voicelive.domain.live;

import java.util.Map;

/**
 * Maps the short language chosen by the client to the regional code the upstream speaks.
 */
public final class LiveLanguageCodes {
    public static final String AUTO = "auto";
    private static final String DEFAULT_CODE = "en-IN";

    private static final Map<String, String> CODES = Map.ofEntries(
            Map.entry("en", "en-IN"),
            Map.entry("hi", "hi-IN"),
            Map.entry("ta", "ta-IN"),
            Map.entry("te", "te-IN"),
            Map.entry("mr", "mr-IN"),
            Map.entry("bn", "bn-IN"),
            Map.entry("gu", "gu-IN"),
            Map.entry("kn", "kn-IN"),
            Map.entry("ml", "ml-IN"),
            Map.entry("pa", "pa-IN"),
            Map.entry("or", "or-IN"),
            Map.entry("en-US", "en-US"),
            Map.entry("en-GB", "en-GB"),
            Map.entry("es", "es-ES"),
            Map.entry("fr", "fr-FR"),
            Map.entry("de", "de-DE"),
            Map.entry("it", "it-IT"),
            Map.entry("pt", "pt-BR"),
            Map.entry("ja", "ja-JP"),
            Map.entry("ko", "ko-KR"),
            Map.entry("zh", "zh-CN"),
            Map.entry("ar", "ar-SA"),
            Map.entry("ru", "ru-RU"),
            Map.entry("tr", "tr-TR"),
            Map.entry("id", "id-ID"),
            Map.entry("vi", "vi-VN"),
            Map.entry("th", "th-TH"),
            Map.entry("pl", "pl-PL"),
            Map.entry("nl", "nl-NL"),
            Map.entry("uk", "uk-UA")
    );

    private LiveLanguageCodes() {
    }

    /**
     * Returns {@code null} for {@code auto} so the upstream detects the language itself.
     */
    public static String regionalCode(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_CODE;
        }
        if (AUTO.equalsIgnoreCase(language.trim())) {
            return null;
        }
        return CODES.getOrDefault(language.trim(), DEFAULT_CODE);
    }

    public static boolean isAuto(String language) {
        return language != null && AUTO.equalsIgnoreCase(language.trim());
    }
}
