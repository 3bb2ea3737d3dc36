package me.go_gradually.voicelive.domain.quality;

import me.go_gradually.voicelive.domain.session.LocalizedPrompts;
import me.go_gradually.voicelive.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Transcription quality checks. Every check runs on every result, so one transcript may yield several issues.
 */
public final class ConversationQualityAnalyzer {
    static final double CRITICAL_CONFIDENCE = 0.3;
    static final double HIGH_CONFIDENCE = 0.5;
    static final double MEDIUM_CONFIDENCE = 0.6;
    static final double NOISE_CONFIDENCE = 0.4;
    static final int MIN_WORDS = 3;

    private static final Pattern PUNCTUATION = Pattern.compile("[.,!?;:\\s]");
    private static final Pattern MARKER_ONLY = Pattern.compile("^[\\[\\]()*]+$");
    private static final List<String> NOISE_MARKERS = List.of(
            "[noise]", "[inaudible]", "[music]", "[background noise]", "***", "[unintelligible]"
    );
    private static final Map<String, Set<String>> FILLERS = Map.of(
            "en", Set.of("um", "uh", "like", "you know", "i mean", "actually", "basically"),
            "hi", Set.of("उम", "आ", "वो", "मतलब", "यानी"),
            "ta", Set.of("அது", "இது", "அப்படி"),
            "te", Set.of("అది", "ఇది", "అలా"),
            "bn", Set.of("উম", "আ", "সেটা")
    );

    private static final Map<String, Map<RecommendedAction, String>> MESSAGES = Map.of(
            "en", Map.of(
                    RecommendedAction.REQUEST_REPEAT, "I didn't quite catch that. Could you please repeat?",
                    RecommendedAction.REQUEST_CLARIFICATION, "I'm having trouble understanding. Can you rephrase that?",
                    RecommendedAction.SUGGEST_QUIET_LOCATION, "There seems to be background noise. Could you move to a quieter place?",
                    RecommendedAction.OFFER_LANGUAGE_SWITCH, "I detected a different language. Would you like to switch?",
                    RecommendedAction.CONTINUE_WITH_CAUTION, "I heard you, but I'm not completely sure. Please continue."
            ),
            "hi", Map.of(
                    RecommendedAction.REQUEST_REPEAT, "मैं ठीक से समझ नहीं पाया। क्या आप दोबारा बोल सकते हैं?",
                    RecommendedAction.REQUEST_CLARIFICATION, "मुझे समझने में परेशानी हो रही है। क्या आप इसे दूसरे तरीके से कह सकते हैं?",
                    RecommendedAction.SUGGEST_QUIET_LOCATION, "पीछे से शोर आ रहा है। क्या आप किसी शांत जगह पर जा सकते हैं?",
                    RecommendedAction.OFFER_LANGUAGE_SWITCH, "मुझे दूसरी भाषा सुनाई दी। क्या आप भाषा बदलना चाहेंगे?",
                    RecommendedAction.CONTINUE_WITH_CAUTION, "मैंने सुना, पर पूरी तरह पक्का नहीं हूँ। कृपया जारी रखें।"
            ),
            "ta", Map.of(
                    RecommendedAction.REQUEST_REPEAT, "எனக்கு சரியாக கேட்கவில்லை. மீண்டும் சொல்ல முடியுமா?",
                    RecommendedAction.REQUEST_CLARIFICATION, "புரிந்துகொள்வதில் சிரமம் உள்ளது. வேறு விதமாக சொல்ல முடியுமா?",
                    RecommendedAction.SUGGEST_QUIET_LOCATION, "பின்னணி சத்தம் உள்ளது. அமைதியான இடத்திற்கு செல்ல முடியுமா?",
                    RecommendedAction.OFFER_LANGUAGE_SWITCH, "வேறு மொழி கேட்கிறது. மொழியை மாற்ற விரும்புகிறீர்களா?",
                    RecommendedAction.CONTINUE_WITH_CAUTION, "நான் கேட்டேன், ஆனால் முழுமையாக உறுதியாக இல்லை. தொடருங்கள்."
            )
    );

    private ConversationQualityAnalyzer() {
    }

    public static List<Issue> analyze(TranscriptionResult result, String expectedLanguage) {
        List<Issue> issues = new ArrayList<>();
        if (result == null || !result.success() || TextUtils.isBlank(result.transcript())) {
            String transcript = result == null ? "" : result.transcript();
            double confidence = result == null ? 0.0 : result.confidence();
            issues.add(new Issue(IssueType.EMPTY_TRANSCRIPT, Severity.CRITICAL, transcript, confidence,
                    "No transcript received"));
            return issues;
        }

        String transcript = result.transcript().trim();
        double confidence = result.confidence();
        String language = LocalizedPrompts.baseLanguage(expectedLanguage);
        List<String> words = TextUtils.words(transcript.toLowerCase(Locale.ROOT));

        checkConfidence(transcript, confidence, issues);
        checkCoherence(transcript, confidence, words, language, issues);
        checkPartial(transcript, confidence, words, result.isFinal(), issues);
        checkLanguage(transcript, confidence, result.languageCode(), expectedLanguage, issues);
        checkEmpty(transcript, confidence, issues);
        checkNoise(transcript, confidence, words, issues);
        return issues;
    }

    private static void checkConfidence(String transcript, double confidence, List<Issue> issues) {
        String percent = Math.round(confidence * 100) + "%";
        if (confidence < CRITICAL_CONFIDENCE) {
            issues.add(new Issue(IssueType.LOW_CONFIDENCE, Severity.CRITICAL, transcript, confidence,
                    "Very low confidence: " + percent));
        } else if (confidence < HIGH_CONFIDENCE) {
            issues.add(new Issue(IssueType.LOW_CONFIDENCE, Severity.HIGH, transcript, confidence,
                    "Low confidence: " + percent));
        } else if (confidence < MEDIUM_CONFIDENCE) {
            issues.add(new Issue(IssueType.LOW_CONFIDENCE, Severity.MEDIUM, transcript, confidence,
                    "Moderate confidence: " + percent));
        }
    }

    private static void checkCoherence(String transcript,
                                       double confidence,
                                       List<String> words,
                                       String language,
                                       List<Issue> issues) {
        if (words.size() < MIN_WORDS) {
            return;
        }
        Set<String> fillers = FILLERS.getOrDefault(language, FILLERS.get("en"));
        List<String> meaningful = new ArrayList<>();
        for (String word : words) {
            if (!fillers.contains(word)) {
                meaningful.add(word);
            }
        }
        if (meaningful.isEmpty()) {
            issues.add(new Issue(IssueType.INCOHERENT_SPEECH, Severity.HIGH, transcript, confidence,
                    "Only filler words detected"));
            return;
        }

        // 단어별 세 번째 등장부터 하나씩 센다.
        Map<String, Integer> counts = new HashMap<>();
        int repeated = 0;
        for (String word : meaningful) {
            if (word.length() > 2 && counts.merge(word, 1, Integer::sum) > 2) {
                repeated++;
            }
        }
        if ((double) repeated / meaningful.size() > 0.3) {
            issues.add(new Issue(IssueType.INCOHERENT_SPEECH, Severity.HIGH, transcript, confidence,
                    "Excessive word repetition"));
            return;
        }

        long fragments = words.stream().filter(word -> word.length() <= 2).count();
        if ((double) fragments / words.size() > 0.5) {
            issues.add(new Issue(IssueType.INCOHERENT_SPEECH, Severity.HIGH, transcript, confidence,
                    "Fragmented speech detected"));
            return;
        }

        for (int i = 1; i < words.size(); i++) {
            String word = words.get(i);
            if (word.length() > 2 && word.equals(words.get(i - 1))) {
                issues.add(new Issue(IssueType.INCOHERENT_SPEECH, Severity.MEDIUM, transcript, confidence,
                        "Stuttering detected"));
                return;
            }
        }
    }

    private static void checkPartial(String transcript,
                                     double confidence,
                                     List<String> words,
                                     boolean isFinal,
                                     List<Issue> issues) {
        if (isFinal && words.size() < MIN_WORDS) {
            issues.add(new Issue(IssueType.PARTIAL_RECOGNITION, Severity.MEDIUM, transcript, confidence,
                    "Very short transcript: " + words.size() + " words"));
        }
    }

    private static void checkLanguage(String transcript,
                                      double confidence,
                                      String detected,
                                      String expected,
                                      List<Issue> issues) {
        if (TextUtils.isBlank(detected) || TextUtils.isBlank(expected)) {
            return;
        }
        String detectedBase = LocalizedPrompts.baseLanguage(detected);
        String expectedBase = LocalizedPrompts.baseLanguage(expected);
        if (!detectedBase.equals(expectedBase)) {
            issues.add(new Issue(IssueType.LANGUAGE_MISMATCH, Severity.MEDIUM, transcript, confidence,
                    "Expected " + expected + ", detected " + detected));
        }
    }

    private static void checkEmpty(String transcript, double confidence, List<Issue> issues) {
        String stripped = PUNCTUATION.matcher(transcript).replaceAll("");
        if (stripped.isEmpty()) {
            issues.add(new Issue(IssueType.EMPTY_TRANSCRIPT, Severity.CRITICAL, transcript, confidence,
                    "Transcript has no content"));
        } else if (MARKER_ONLY.matcher(stripped).matches()) {
            issues.add(new Issue(IssueType.EMPTY_TRANSCRIPT, Severity.HIGH, transcript, confidence,
                    "Transcript contains only markers"));
        }
    }

    private static void checkNoise(String transcript, double confidence, List<String> words, List<Issue> issues) {
        String lowered = transcript.toLowerCase(Locale.ROOT);
        for (String marker : NOISE_MARKERS) {
            if (lowered.contains(marker)) {
                issues.add(new Issue(IssueType.BACKGROUND_NOISE, Severity.HIGH, transcript, confidence,
                        "Noise marker detected: " + marker));
                return;
            }
        }
        if (confidence < NOISE_CONFIDENCE && words.size() < MIN_WORDS) {
            issues.add(new Issue(IssueType.BACKGROUND_NOISE, Severity.MEDIUM, transcript, confidence,
                    "Possible background noise"));
        }
    }

    public static RecommendedAction recommendedAction(List<Issue> issues) {
        if (issues == null || issues.isEmpty()) {
            return RecommendedAction.CONTINUE;
        }
        if (issues.stream().anyMatch(issue -> issue.severity() == Severity.CRITICAL)) {
            return RecommendedAction.REQUEST_REPEAT;
        }
        if (hasType(issues, IssueType.BACKGROUND_NOISE)) {
            return RecommendedAction.SUGGEST_QUIET_LOCATION;
        }
        if (hasType(issues, IssueType.INCOHERENT_SPEECH)) {
            return RecommendedAction.REQUEST_CLARIFICATION;
        }
        if (hasType(issues, IssueType.LANGUAGE_MISMATCH)) {
            return RecommendedAction.OFFER_LANGUAGE_SWITCH;
        }
        for (Issue issue : issues) {
            if (issue.type() == IssueType.LOW_CONFIDENCE) {
                return issue.severity() == Severity.CRITICAL
                        ? RecommendedAction.REQUEST_REPEAT
                        : RecommendedAction.REQUEST_CLARIFICATION;
            }
        }
        return RecommendedAction.CONTINUE_WITH_CAUTION;
    }

    public static double qualityScore(List<Issue> issues) {
        if (issues == null || issues.isEmpty()) {
            return 1.0;
        }
        double penalty = 0.0;
        for (Issue issue : issues) {
            penalty += issue.severity().qualityPenalty();
        }
        return Math.max(0.0, 1.0 - Math.min(1.0, penalty));
    }

    /**
     * Text to speak for an action, or an empty string for {@link RecommendedAction#CONTINUE}.
     */
    public static String message(RecommendedAction action, String language) {
        if (action == null || action == RecommendedAction.CONTINUE) {
            return "";
        }
        Map<RecommendedAction, String> table = MESSAGES.getOrDefault(
                LocalizedPrompts.baseLanguage(language), MESSAGES.get("en"));
        String text = table.get(action);
        return text == null ? MESSAGES.get("en").getOrDefault(action, "") : text;
    }

    /**
     * The issue that drives fallback selection: highest severity, first reported on ties.
     */
    public static Issue primaryIssue(List<Issue> issues) {
        Issue primary = null;
        if (issues == null) {
            return null;
        }
        for (Issue issue : issues) {
            if (primary == null || issue.severity().isMoreSevereThan(primary.severity())) {
                primary = issue;
            }
        }
        return primary;
    }

    private static boolean hasType(List<Issue> issues, IssueType type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }
}
