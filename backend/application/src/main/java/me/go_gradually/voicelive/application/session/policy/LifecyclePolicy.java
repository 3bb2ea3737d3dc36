package me.go_gradually.voicelive.application.session.policy;

public interface LifecyclePolicy {
    long durationWarningSeconds();

    long warningTimeoutSeconds();

    long inactivityTimeoutSeconds();

    long checkIntervalSeconds();

    long closeGraceMs();
}
