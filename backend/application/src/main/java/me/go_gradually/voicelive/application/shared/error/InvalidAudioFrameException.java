package me.go_gradually.voicelive.application.shared.error;

public class InvalidAudioFrameException extends VoiceLiveException {
    public InvalidAudioFrameException(String message) {
        super(message);
    }

    public InvalidAudioFrameException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "INVALID_AUDIO";
    }
}
