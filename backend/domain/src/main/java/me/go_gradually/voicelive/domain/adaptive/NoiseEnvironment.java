package me.go_gradually.voicelive.domain.adaptive;

public enum NoiseEnvironment {
    LOW,
    MEDIUM,
    HIGH
}
