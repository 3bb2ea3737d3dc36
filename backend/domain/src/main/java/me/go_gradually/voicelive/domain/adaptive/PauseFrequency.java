package me.go_gradually.voicelive.domain.adaptive;

public enum PauseFrequency {
    RARE,
    NORMAL,
    FREQUENT
}
