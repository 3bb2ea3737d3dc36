package me.go_gradually.voicelive.application.shared.error;

public interface ErrorDisclosurePolicy {
    /**
     * When true, clients only see a fixed message per error code.
     */
    boolean productionErrors();
}
