package me.go_gradually.voicelive.domain.adaptive;

public enum SpeechClarity {
    HIGH,
    MEDIUM,
    LOW
}
