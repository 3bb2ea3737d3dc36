package me.go_gradually.voicelive.domain.interruption;

import java.util.Locale;

public enum InterruptionType {
    CLARIFICATION,
    CORRECTION,
    URGENT,
    BARGE_IN,
    CUT_OFF;

    /**
     * Whether the reply should open with a short acknowledgment phrase.
     */
    public boolean acknowledges() {
        return this == CLARIFICATION || this == CORRECTION || this == URGENT;
    }

    /**
     * Whether the user asked for a fresh answer instead of a continuation.
     */
    public boolean wantsFreshAnswer() {
        return this == CORRECTION || this == URGENT;
    }

    public static InterruptionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return BARGE_IN;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return BARGE_IN;
        }
    }
}
