package me.go_gradually.voicelive.domain.session;

import java.util.UUID;

public record SessionId(String value) {
    public SessionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId is required");
        }
    }

    public static SessionId of(String value) {
        return new SessionId(value);
    }

    public static SessionId random() {
        return new SessionId(UUID.randomUUID().toString());
    }
}
