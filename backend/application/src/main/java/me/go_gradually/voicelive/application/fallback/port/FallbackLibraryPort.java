package me.go_gradually.voicelive.application.fallback.port;

import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.quality.IssueType;

import java.util.Optional;

public interface FallbackLibraryPort {
    /**
     * Looks up a pre-recorded clip, rotating through variants by attempt count.
     */
    Optional<FallbackEntry> find(String language, IssueType type, int attemptCount);
}
