package me.go_gradually.voicelive.application.history.model;

import java.time.Instant;

public record HistoryMessage(String role, String text, Instant at) {
    public static final String USER = "user";
    public static final String MODEL = "model";
}
