package me.go_gradually.voicelive.application.shared.error;

public class UnknownSessionException extends VoiceLiveException {
    public UnknownSessionException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "UNKNOWN_SESSION";
    }
}
