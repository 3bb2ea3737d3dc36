package me.go_gradually.voicelive.application.shared.error;

public class TranscriptionFailureException extends VoiceLiveException {
    public TranscriptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "TRANSCRIPTION_FAILED";
    }
}
