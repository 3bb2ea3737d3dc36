package me.go_gradually.voicelive.domain.interruption;

import java.time.Instant;
import java.util.List;

public record InterruptionContext(Instant timestamp,
                                  InterruptionType type,
                                  AiResponseSnapshot aiResponse,
                                  UserInterruption userInterruption,
                                  boolean canResume) {
    static final double MIN_RESUMABLE_PROGRESS = 0.2;
    static final double MAX_RESUMABLE_PROGRESS = 0.9;

    public static InterruptionContext from(InterruptionEvent event, String lastAiResponse) {
        AiResponseSnapshot snapshot = AiResponseSnapshot.split(lastAiResponse, event.progress());
        UserInterruption user = new UserInterruption(event.partialText(), event.confidence(), event.intensity());
        return new InterruptionContext(
                event.occurredAt(),
                event.type(),
                snapshot,
                user,
                resumable(event.type(), event.progress())
        );
    }

    public static boolean resumable(InterruptionType type, double progress) {
        if (type == null || type.wantsFreshAnswer()) {
            return false;
        }
        return progress >= MIN_RESUMABLE_PROGRESS && progress <= MAX_RESUMABLE_PROGRESS;
    }

    public record AiResponseSnapshot(String fullText, String spokenText, String remainingText, double progress) {
        /**
         * Splits the reply at the word boundary closest to the played fraction.
         */
        public static AiResponseSnapshot split(String fullText, double progress) {
            String text = fullText == null ? "" : fullText.trim();
            if (text.isEmpty()) {
                return new AiResponseSnapshot("", "", "", progress);
            }
            List<String> words = List.of(text.split("\\s+"));
            int spokenCount = (int) Math.floor(words.size() * progress);
            spokenCount = Math.max(0, Math.min(words.size(), spokenCount));
            String spoken = String.join(" ", words.subList(0, spokenCount));
            String remaining = String.join(" ", words.subList(spokenCount, words.size()));
            return new AiResponseSnapshot(text, spoken, remaining, progress);
        }
    }

    public record UserInterruption(String text, double confidence, double intensity) {
    }
}
