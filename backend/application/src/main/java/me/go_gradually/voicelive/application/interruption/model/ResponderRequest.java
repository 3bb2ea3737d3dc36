package me.go_gradually.voicelive.application.interruption.model;

import me.go_gradually.voicelive.domain.adaptive.ResponseSettings;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;

/**
 * @param context      resumable interruption to build on, or {@code null} for a plain reply
 * @param interruption type of the newest unanswered interruption; picks the acknowledgment and instruction.
 *                     Falls back to the context's type when {@code null}.
 */
public record ResponderRequest(String userMessage,
                               InterruptionContext context,
                               InterruptionType interruption,
                               String language,
                               ResponseSettings settings,
                               String sessionInstruction) {
}
