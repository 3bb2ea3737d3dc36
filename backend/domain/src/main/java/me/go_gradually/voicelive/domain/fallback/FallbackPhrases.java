package me.go_gradually.voicelive.domain.fallback;

import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fallback utterance texts.
 * Repeated attempts get an empathetic phrase, frustrated users an apologetic one, everyone else a random template.
 */
public final class FallbackPhrases {
    static final int EMPATHY_ATTEMPT_THRESHOLD = 2;
    static final double APOLOGY_FRUSTRATION_THRESHOLD = 0.7;

    private static final Map<String, Map<IssueType, List<String>>> TEMPLATES = Map.of(
            "en", Map.of(
                    IssueType.LONG_PAUSE, List.of(
                            "I'm listening, please take your time.",
                            "Are you still there? I'm here to help.",
                            "No worries, whenever you're ready."),
                    IssueType.LOW_CONFIDENCE, List.of(
                            "I didn't quite catch that. Could you please repeat?",
                            "Sorry, I couldn't hear you clearly. Can you say that again?",
                            "Could you please speak a bit more clearly?"),
                    IssueType.INCOHERENT_SPEECH, List.of(
                            "I'm having trouble understanding. Can you try again?",
                            "Sorry, that didn't come through clearly. One more time?",
                            "Could you rephrase that for me?"),
                    IssueType.BACKGROUND_NOISE, List.of(
                            "There seems to be some background noise. Could you move to a quieter place?",
                            "I'm having trouble hearing you due to noise. Can you reduce the background sound?",
                            "The audio quality isn't great. Could you try from a quieter location?"),
                    IssueType.NO_SPEECH, List.of(
                            "I haven't heard anything yet. Are you there?",
                            "Hello? I don't seem to be receiving any audio.",
                            "Can you hear me? I'm not getting any sound from your end."),
                    IssueType.CONNECTION_ISSUE, List.of(
                            "I think we lost connection for a moment. Are you still there?",
                            "Sorry, there was a technical glitch. Could you repeat that?",
                            "We had a brief connection issue. Please continue."),
                    IssueType.LANGUAGE_MISMATCH, List.of(
                            "I detected a different language. Let me switch modes.",
                            "Would you prefer to continue in a different language?",
                            "I can switch languages if that helps."),
                    IssueType.PARTIAL_RECOGNITION, List.of(
                            "I only caught part of that. Could you continue?",
                            "Please go on, I'm listening.",
                            "I heard you, but I'd like to hear more. Please continue."),
                    IssueType.EMPTY_TRANSCRIPT, List.of(
                            "I didn't catch anything. Could you try again?",
                            "I'm not receiving any audio. Please speak again.",
                            "Nothing came through. Can you repeat that?")
            ),
            "hi", Map.of(
                    IssueType.LONG_PAUSE, List.of(
                            "मैं सुन रहा हूं, अपना समय लें।",
                            "क्या आप अभी भी हैं? मैं मदद के लिए यहां हूं।",
                            "कोई बात नहीं, जब भी आप तैयार हों।"),
                    IssueType.LOW_CONFIDENCE, List.of(
                            "मैं ठीक से सुन नहीं पाया। क्या आप दोहरा सकते हैं?",
                            "माफ़ करें, मुझे स्पष्ट रूप से नहीं सुनाई दिया। फिर से बताएं?",
                            "क्या आप थोड़ा स्पष्ट बोल सकते हैं?"),
                    IssueType.INCOHERENT_SPEECH, List.of(
                            "मुझे समझने में परेशानी हो रही है। क्या आप फिर से कोशिश कर सकते हैं?",
                            "माफ़ करें, वह स्पष्ट नहीं आया। एक बार और?",
                            "क्या आप इसे दूसरे तरीके से बता सकते हैं?"),
                    IssueType.BACKGROUND_NOISE, List.of(
                            "पृष्ठभूमि में कुछ शोर है। क्या आप शांत जगह पर जा सकते हैं?",
                            "शोर के कारण मुझे सुनने में परेशानी हो रही है।",
                            "ऑडियो क्वालिटी अच्छी नहीं है। शांत जगह से कोशिश करें?"),
                    IssueType.NO_SPEECH, List.of(
                            "मैंने अभी तक कुछ नहीं सुना। क्या आप हैं?",
                            "हेलो? मुझे कोई ऑडियो नहीं मिल रहा।",
                            "क्या आप मुझे सुन सकते हैं? मुझे आपकी आवाज़ नहीं मिल रही।"),
                    IssueType.PARTIAL_RECOGNITION, List.of(
                            "मैंने केवल कुछ हिस्सा सुना। कृपया जारी रखें।",
                            "कृपया आगे बढ़ें, मैं सुन रहा हूं।")
            ),
            "ta", Map.of(
                    IssueType.LONG_PAUSE, List.of(
                            "நான் கேட்டுக்கொண்டிருக்கிறேன், உங்கள் நேரத்தை எடுத்துக் கொள்ளுங்கள்.",
                            "நீங்கள் இன்னும் இருக்கிறீர்களா? நான் உதவ இங்கே இருக்கிறேன்."),
                    IssueType.LOW_CONFIDENCE, List.of(
                            "நான் அதை சரியாகக் கேட்கவில்லை. தயவுசெய்து மீண்டும் சொல்ல முடியுமா?",
                            "மன்னிக்கவும், எனக்கு தெளிவாகக் கேட்கவில்லை."),
                    IssueType.BACKGROUND_NOISE, List.of(
                            "பின்னணியில் சில சத்தம் இருக்கிறது. அமைதியான இடத்திற்கு செல்ல முடியுமா?")
            )
    );

    private static final Map<String, Map<IssueType, String>> EMPATHETIC = Map.of(
            "en", Map.of(
                    IssueType.LOW_CONFIDENCE, "I understand it's frustrating. Let's try once more, and I'll listen carefully.",
                    IssueType.BACKGROUND_NOISE, "I know the noise is bothersome. Take your time to find a quieter spot.",
                    IssueType.NO_SPEECH, "No problem at all. Whenever you're ready to speak, I'm here.",
                    IssueType.INCOHERENT_SPEECH, "I'm sorry for the difficulty. Let's take it slow, what would you like to tell me?"
            ),
            "hi", Map.of(
                    IssueType.LOW_CONFIDENCE, "मैं समझता हूं यह निराशाजनक है। चलिए एक बार और कोशिश करते हैं।",
                    IssueType.BACKGROUND_NOISE, "मुझे पता है शोर परेशान कर रहा है। शांत जगह खोजने के लिए अपना समय लें।",
                    IssueType.NO_SPEECH, "कोई समस्या नहीं। जब भी आप तैयार हों, मैं यहाँ हूँ।"
            )
    );

    private static final Map<String, Map<IssueType, String>> APOLOGETIC = Map.of(
            "en", Map.of(
                    IssueType.LOW_CONFIDENCE, "I apologize for the trouble. Let me try my best to understand you.",
                    IssueType.BACKGROUND_NOISE, "I'm sorry about the audio issues. Would you like to try typing instead?",
                    IssueType.INCOHERENT_SPEECH, "I'm really sorry for the confusion. Let's start fresh, what can I help you with?"
            ),
            "hi", Map.of(
                    IssueType.LOW_CONFIDENCE, "परेशानी के लिए मैं माफी चाहता हूं। मैं आपको समझने की पूरी कोशिश करूंगा।",
                    IssueType.BACKGROUND_NOISE, "ऑडियो समस्याओं के लिए मुझे खेद है। क्या आप टाइप करना पसंद करेंगे?"
            )
    );

    private FallbackPhrases() {
    }

    public static String select(IssueType type, String language, int attemptCount, double frustrationLevel, Random random) {
        String lang = LocalizedPrompts.baseLanguage(language);
        if (attemptCount > EMPATHY_ATTEMPT_THRESHOLD) {
            return single(EMPATHETIC, lang, type);
        }
        if (frustrationLevel > APOLOGY_FRUSTRATION_THRESHOLD) {
            return single(APOLOGETIC, lang, type);
        }
        List<String> templates = templates(lang, type);
        return templates.get(random.nextInt(templates.size()));
    }

    public static List<String> templates(String language, IssueType type) {
        Map<IssueType, List<String>> table = TEMPLATES.getOrDefault(
                LocalizedPrompts.baseLanguage(language), TEMPLATES.get("en"));
        List<String> templates = table.get(type);
        return templates == null ? table.get(IssueType.LOW_CONFIDENCE) : templates;
    }

    private static String single(Map<String, Map<IssueType, String>> source, String language, IssueType type) {
        Map<IssueType, String> table = source.getOrDefault(language, source.get("en"));
        String text = table.get(type);
        return text == null ? table.get(IssueType.LOW_CONFIDENCE) : text;
    }
}
