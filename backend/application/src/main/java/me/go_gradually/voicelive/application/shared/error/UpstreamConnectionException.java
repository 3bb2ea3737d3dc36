package me.go_gradually.voicelive.application.shared.error;

public class UpstreamConnectionException extends VoiceLiveException {
    public UpstreamConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "CONNECTION_ERROR";
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
