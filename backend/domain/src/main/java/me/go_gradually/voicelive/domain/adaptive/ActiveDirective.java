package me.go_gradually.voicelive.domain.adaptive;

import java.time.Duration;
import java.time.Instant;

public record ActiveDirective(AdaptationDirective directive, Instant activatedAt) {
    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(activatedAt, now).compareTo(ttl) > 0;
    }
}
