package me.go_gradually.voicelive.application.shared.error;

public class SessionIdReusedException extends VoiceLiveException {
    public SessionIdReusedException(String sessionId) {
        super("Session id was already used: " + sessionId);
    }

    @Override
    public String code() {
        return "SESSION_ID_REUSED";
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
