package me.go_gradually.voicelive.application.shared.error;

public class UpstreamSetupException extends VoiceLiveException {
    public UpstreamSetupException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "SETUP_ERROR";
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
