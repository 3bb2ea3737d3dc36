package me.go_gradually.voicelive.domain.session;

public enum SessionStopReason {
    CLIENT_ENDED("CLIENT_ENDED"),
    TRANSPORT_CLOSED("TRANSPORT_CLOSED"),
    INACTIVITY_TIMEOUT("INACTIVITY_TIMEOUT"),
    DURATION_TIMEOUT("DURATION_TIMEOUT"),
    CONNECTION_FAILED("CONNECTION_FAILED"),
    SETUP_FAILED("SETUP_FAILED"),
    UPSTREAM_CLOSED("UPSTREAM_CLOSED");

    private final String code;

    SessionStopReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTimeout() {
        return this == INACTIVITY_TIMEOUT || this == DURATION_TIMEOUT;
    }
}
