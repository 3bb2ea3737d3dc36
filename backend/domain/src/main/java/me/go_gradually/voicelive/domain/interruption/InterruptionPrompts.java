package me.go_gradually.voicelive.domain.interruption;

import me.go_gradually.voicelive.domain.adaptive.ResponseSettings;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Prompt text and localized phrases for replies that follow an interruption.
 */
public final class InterruptionPrompts {
    static final String BASE_INSTRUCTION = "You are a helpful AI assistant in a natural voice conversation.";

    private static final Map<InterruptionType, String> TYPE_INSTRUCTIONS = Map.of(
            InterruptionType.CLARIFICATION,
            "The user asked for clarification. Be concise and clear, repeat the relevant part in simpler words.",
            InterruptionType.CORRECTION,
            "The user corrected you. Acknowledge gracefully and give the corrected answer without arguing.",
            InterruptionType.URGENT,
            "The user interrupted urgently. Respond promptly and address their need first.",
            InterruptionType.BARGE_IN,
            "The user spoke while you were talking. Continue naturally and don't mention the interruption.",
            InterruptionType.CUT_OFF,
            "The user cut you off. Treat it as a fresh start and answer what they said."
    );

    private static final Map<String, Map<InterruptionType, List<String>>> ACKNOWLEDGMENTS = Map.of(
            "en", Map.of(
                    InterruptionType.CLARIFICATION, List.of("Let me clarify: ", "Sure, ", "Of course - ", "To explain that - "),
                    InterruptionType.CORRECTION, List.of("Oh, I understand now. ", "You're right, ", "Got it - ", "I see, "),
                    InterruptionType.URGENT, List.of("Yes, I'm here. ", "What do you need? ", "I'm listening - ", "Yes? ")
            ),
            "hi", Map.of(
                    InterruptionType.CLARIFICATION, List.of("मैं समझाता हूँ: ", "ज़रूर, ", "बिल्कुल - "),
                    InterruptionType.CORRECTION, List.of("अच्छा, अब समझ गया। ", "आप सही हैं, ", "ठीक है - "),
                    InterruptionType.URGENT, List.of("हाँ, मैं यहाँ हूँ। ", "बताइए? ", "मैं सुन रहा हूँ - ")
            ),
            "ta", Map.of(
                    InterruptionType.CLARIFICATION, List.of("விளக்குகிறேன்: ", "நிச்சயமாக, ", "சரி - "),
                    InterruptionType.CORRECTION, List.of("புரிந்தது. ", "நீங்கள் சொல்வது சரி, ", "சரி - "),
                    InterruptionType.URGENT, List.of("ஆம், நான் இங்கே இருக்கிறேன். ", "சொல்லுங்கள்? ", "கேட்கிறேன் - ")
            )
    );

    private InterruptionPrompts() {
    }

    public static String contextualPrompt(InterruptionContext context, String userMessage) {
        String message = userMessage == null ? "" : userMessage;
        InterruptionContext.AiResponseSnapshot ai = context.aiResponse();
        return "[CONVERSATION CONTEXT]\n"
                + "I was saying: \"" + ai.spokenText() + "\"\n"
                + "I was interrupted at " + Math.round(ai.progress() * 100) + "% through my response.\n"
                + "The user interrupted to say: \"" + message + "\"\n"
                + "Interruption type: " + context.type() + "\n\n"
                + "[INSTRUCTIONS]\n"
                + "- If the user wants clarification about what I said, explain that part clearly\n"
                + "- If the user is correcting me, acknowledge gracefully and provide corrected response\n"
                + "- If the user wants me to continue, offer to resume or rephrase\n"
                + "- If the user has a new question, answer it directly while being aware of the context\n\n"
                + "User's message: " + message;
    }

    public static String systemInstruction(InterruptionType type, ResponseSettings style) {
        InterruptionType effective = type == null ? InterruptionType.BARGE_IN : type;
        StringBuilder builder = new StringBuilder(BASE_INSTRUCTION)
                .append('\n')
                .append(TYPE_INSTRUCTIONS.get(effective));
        if (style != null) {
            switch (style.style()) {
                case CONCISE -> builder.append("\nKeep responses under ").append(style.maxWords()).append(" words")
                        .append("\nBe direct")
                        .append("\nAvoid unnecessary elaboration");
                case DETAILED -> builder.append("\nProvide detailed explanations")
                        .append("\nInclude examples")
                        .append("\nBe thorough but organized");
                case SIMPLE -> builder.append("\nUse simple, clear language")
                        .append("\nAvoid jargon")
                        .append("\nBe patient and reassuring");
                default -> {
                }
            }
        }
        return builder.toString();
    }

    /**
     * Returns an acknowledgment prefix, or an empty string for types that continue silently.
     */
    public static String acknowledgment(InterruptionType type, String language, Random random) {
        if (type == null || !type.acknowledges()) {
            return "";
        }
        Map<InterruptionType, List<String>> table = ACKNOWLEDGMENTS.getOrDefault(
                LocalizedPrompts.baseLanguage(language), ACKNOWLEDGMENTS.get("en"));
        List<String> phrases = table.get(type);
        return phrases.get(random.nextInt(phrases.size()));
    }

    public static String resumePhrase(InterruptionContext context, String language, Random random) {
        InterruptionContext.AiResponseSnapshot ai = context.aiResponse();
        String spoken = ai.spokenText().length() > 50 ? ai.spokenText().substring(0, 50) : ai.spokenText();
        String remaining = ai.remainingText();
        List<String> phrases = switch (LocalizedPrompts.baseLanguage(language)) {
            case "hi" -> List.of(
                    "क्या मैं वहीं से जारी रखूँ? मैं कह रहा था: \"" + spoken + "...\"",
                    "मैं आगे बताता हूँ। " + remaining,
                    "अपनी पिछली बात पूरी करूँ: " + remaining
            );
            case "ta" -> List.of(
                    "நான் விட்ட இடத்திலிருந்து தொடரட்டுமா? நான் சொன்னது: \"" + spoken + "...\"",
                    "தொடர்கிறேன். " + remaining,
                    "என் முந்தைய கருத்தை முடிக்க: " + remaining
            );
            default -> List.of(
                    "Should I continue from where I left off? I was saying: \"" + spoken + "...\"",
                    "Let me continue. " + remaining,
                    "To finish my previous point: " + remaining
            );
        };
        return phrases.get(random.nextInt(phrases.size()));
    }
}
