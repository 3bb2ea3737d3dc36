package me.go_gradually.voicelive.domain.session;

public enum SessionPhase {
    CONNECTING,
    HANDSHAKING,
    ACTIVE,
    PRIMING,
    DURATION_WARNED,
    CLOSING,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }

    /**
     * Phases the lifecycle supervisor inspects on each check.
     */
    public boolean isSupervised() {
        return this == ACTIVE || this == DURATION_WARNED;
    }
}
