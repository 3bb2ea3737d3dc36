package me.go_gradually.voicelive.domain.quality;

public enum IssueType {
    EMPTY_TRANSCRIPT,
    LOW_CONFIDENCE,
    INCOHERENT_SPEECH,
    PARTIAL_RECOGNITION,
    LANGUAGE_MISMATCH,
    BACKGROUND_NOISE,
    LONG_PAUSE,
    NO_SPEECH,
    CONNECTION_ISSUE
}
