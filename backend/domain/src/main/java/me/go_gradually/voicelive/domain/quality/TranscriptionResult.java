package me.go_gradually.voicelive.domain.quality;

public record TranscriptionResult(boolean success,
                                  String transcript,
                                  double confidence,
                                  boolean isFinal,
                                  String languageCode) {
    public TranscriptionResult {
        transcript = transcript == null ? "" : transcript;
    }

    public static TranscriptionResult failed() {
        return new TranscriptionResult(false, "", 0.0, true, null);
    }
}
