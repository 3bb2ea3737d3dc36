package me.go_gradually.voicelive.domain.session;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed phrases the engine speaks on its own initiative.
 * Unknown languages fall back to English.
 */
public final class LocalizedPrompts {
    private static final String DEFAULT_LANGUAGE = "en";

    private static final Map<String, String> DURATION_WARNING = Map.of(
            "en", "Would you like to continue the conversation?",
            "hi", "क्या आप बात जारी रखना चाहते हैं?",
            "ta", "உங்களுக்கு உரையாடலைத் தொடர விருப்பமா?"
    );
    private static final Map<String, String> INACTIVITY_GOODBYE = Map.of(
            "en", "Okay, talk to you later. Thank you!",
            "hi", "ठीक है, बाद में बात करते हैं। धन्यवाद!",
            "ta", "சரி, பிறகு பேசுவோம். நன்றி!"
    );
    private static final Map<String, String> DURATION_GOODBYE = Map.of(
            "en", "Alright, it was nice helping you. See you again!",
            "hi", "ठीक है, आपकी मदद करके खुशी हुई। फिर मिलेंगे!",
            "ta", "சரி, உங்களுக்கு உதவியது மகிழ்ச்சி. மீண்டும் சந்திப்போம்!"
    );
    private static final Map<String, String> GREETING = Map.of(
            "en", "Hello! I'm here to help you.",
            "hi", "नमस्ते! मैं आपकी मदद के लिए यहाँ हूँ।",
            "ta", "வணக்கம்! நான் உங்களுக்கு உதவ இங்கே இருக்கிறேன்.",
            "es", "¡Hola! Estoy aquí para ayudarte."
    );

    private LocalizedPrompts() {
    }

    public static String durationWarning(String language) {
        return lookup(DURATION_WARNING, language);
    }

    public static String inactivityGoodbye(String language) {
        return lookup(INACTIVITY_GOODBYE, language);
    }

    public static String durationGoodbye(String language) {
        return lookup(DURATION_GOODBYE, language);
    }

    public static String goodbye(SessionStopReason reason, String language) {
        if (reason == SessionStopReason.DURATION_TIMEOUT) {
            return durationGoodbye(language);
        }
        return inactivityGoodbye(language);
    }

    public static String greeting(String language) {
        return lookup(GREETING, language);
    }

    /**
     * Reduces a tag such as {@code hi-IN} to its base subtag.
     */
    public static String baseLanguage(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        int dash = normalized.indexOf('-');
        return dash > 0 ? normalized.substring(0, dash) : normalized;
    }

    private static String lookup(Map<String, String> table, String language) {
        String text = table.get(baseLanguage(language));
        return text == null ? table.get(DEFAULT_LANGUAGE) : text;
    }
}
