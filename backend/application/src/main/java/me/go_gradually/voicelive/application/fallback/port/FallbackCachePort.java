package me.go_gradually.voicelive.application.fallback.port;

import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackKey;

import java.util.Optional;

/**
 * Process-wide cache shared by all sessions; implementations must be safe for concurrent use.
 */
public interface FallbackCachePort {
    Optional<FallbackEntry> get(FallbackKey key);

    /**
     * Replaces any existing entry for the key.
     */
    void put(FallbackKey key, FallbackEntry entry);

    int size();

    void clear();
}
