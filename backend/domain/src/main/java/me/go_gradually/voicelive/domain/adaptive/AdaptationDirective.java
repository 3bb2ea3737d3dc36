package me.go_gradually.voicelive.domain.adaptive;

public enum AdaptationDirective {
    SUGGEST_TEXT_INPUT("It seems noisy. Would you prefer to type instead?", 0),
    SWITCH_TO_HYBRID_MODE(null, 0),
    INCREASE_SILENCE_THRESHOLD(null, 5000),
    OFFER_ALTERNATIVE("Would you like to speak with a human agent instead?", 0),
    USE_CONCISE_RESPONSES(null, 0),
    USE_DETAILED_RESPONSES(null, 0);

    private final String userMessage;
    private final int parameter;

    AdaptationDirective(String userMessage, int parameter) {
        this.userMessage = userMessage;
        this.parameter = parameter;
    }

    /**
     * Text shown to the user, or {@code null} for silent directives.
     */
    public String userMessage() {
        return userMessage;
    }

    public boolean isSilent() {
        return userMessage == null;
    }

    /**
     * Numeric setting carried by the directive, such as a silence threshold in milliseconds.
     */
    public int parameter() {
        return parameter;
    }
}
