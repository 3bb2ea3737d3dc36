package me.go_gradually.voicelive.domain.quality;

public enum RecommendedAction {
    CONTINUE,
    CONTINUE_WITH_CAUTION,
    REQUEST_REPEAT,
    REQUEST_CLARIFICATION,
    SUGGEST_QUIET_LOCATION,
    OFFER_LANGUAGE_SWITCH;

    public boolean requiresFallback() {
        return this != CONTINUE && this != CONTINUE_WITH_CAUTION;
    }
}
