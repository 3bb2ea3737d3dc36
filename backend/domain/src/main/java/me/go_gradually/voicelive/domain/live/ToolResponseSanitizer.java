package me.go_gradually.voicelive.domain.live;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans the free-text argument of a model tool call so it can be spoken.
 * Malformed or empty input falls back to {@link #DEFAULT_REPLY}.
 */
public final class ToolResponseSanitizer {
    public static final String DEFAULT_REPLY = "Kya madad chahiye aapko?";
    static final int MAX_WORDS = 40;

    private static final Pattern MARKUP = Pattern.compile("[*•\\-–—_~`´]");
    private static final Pattern BRACKETS = Pattern.compile("[()\\[\\]{}]");
    private static final Pattern SLASHES = Pattern.compile("[/\\\\|]");
    private static final Pattern COLONS = Pattern.compile("[:;]");
    private static final Pattern QUOTES = Pattern.compile("[\"']");
    private static final Pattern ANGLES = Pattern.compile("[<>]");
    private static final Pattern NUMBERED = Pattern.compile("\\d+\\.");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ORDINALS = Pattern.compile("\\b(first|second|third|fourth|fifth)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_PHRASES = Pattern.compile("\\b(here are|these are|following)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ITEMS = Pattern.compile("\\b(option|step|point)\\s*\\d*", Pattern.CASE_INSENSITIVE);
    private static final Set<String> QUESTION_WORDS = Set.of(
            "what", "which", "how", "when", "where", "who", "why",
            "kya", "kaise", "kab", "kahan", "kaun", "kyun", "kitna"
    );

    private ToolResponseSanitizer() {
    }

    public static String sanitize(Object argument) {
        if (!(argument instanceof String text) || text.isBlank()) {
            return DEFAULT_REPLY;
        }
        String cleaned = text;
        cleaned = MARKUP.matcher(cleaned).replaceAll("");
        cleaned = BRACKETS.matcher(cleaned).replaceAll("");
        cleaned = SLASHES.matcher(cleaned).replaceAll("");
        cleaned = COLONS.matcher(cleaned).replaceAll("");
        cleaned = QUOTES.matcher(cleaned).replaceAll("");
        cleaned = ANGLES.matcher(cleaned).replaceAll("");
        cleaned = NUMBERED.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();

        cleaned = ORDINALS.matcher(cleaned).replaceAll("");
        cleaned = LIST_PHRASES.matcher(cleaned).replaceAll("");
        cleaned = LIST_ITEMS.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();

        List<String> words = new ArrayList<>(Arrays.asList(cleaned.split(" ")));
        words.removeIf(String::isEmpty);
        if (words.size() > MAX_WORDS) {
            words = words.subList(0, MAX_WORDS);
            cleaned = String.join(" ", words);
        }
        if (cleaned.length() < 5 || words.size() < 2) {
            return DEFAULT_REPLY;
        }
        if (!cleaned.endsWith("?") && !cleaned.endsWith(".")
                && QUESTION_WORDS.contains(words.get(0).toLowerCase(Locale.ROOT))) {
            cleaned = cleaned + "?";
        }
        return cleaned;
    }
}
