package me.go_gradually.voicelive.application.shared.error;

/**
 * Base type for failures reported to the client with a stable code.
 */
public abstract class VoiceLiveException extends RuntimeException {
    protected VoiceLiveException(String message) {
        super(message);
    }

    protected VoiceLiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();

    /**
     * Whether the session cannot continue after this failure.
     */
    public boolean isFatal() {
        return false;
    }
}
