package me.go_gradually.voicelive.application.fallback.usecase;

import me.go_gradually.voicelive.application.fallback.port.FallbackCachePort;
import me.go_gradually.voicelive.application.fallback.port.FallbackLibraryPort;
import me.go_gradually.voicelive.application.pipeline.model.VoiceOptions;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackKey;
import me.go_gradually.voicelive.domain.fallback.FallbackPhrases;
import me.go_gradually.voicelive.domain.fallback.FallbackSource;
import me.go_gradually.voicelive.domain.fallback.FallbackUsage;
import me.go_gradually.voicelive.domain.quality.Issue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Cache, then pre-recorded library, then fresh synthesis. Library and synthesized results are cached before returning.
 */
public class FallbackResponseSelector {
    private static final Logger log = Logger.getLogger(FallbackResponseSelector.class.getName());

    private final FallbackCachePort cache;
    private final FallbackLibraryPort library;
    private final SpeechSynthesisGateway synthesis;
    private final Random random;
    private final Map<String, FallbackUsage> usage = new ConcurrentHashMap<>();

    public FallbackResponseSelector(FallbackCachePort cache,
                                    FallbackLibraryPort library,
                                    SpeechSynthesisGateway synthesis,
                                    Random random) {
        this.cache = cache;
        this.library = library;
        this.synthesis = synthesis;
        this.random = random;
    }

    public FallbackEntry select(Issue issue, String language, int attemptCount, double frustrationLevel) {
        FallbackKey key = new FallbackKey(language, issue.type(), issue.severity());

        Optional<FallbackEntry> cached = cache.get(key);
        if (cached.isPresent()) {
            recordUsage(key, FallbackSource.CACHE);
            return cached.get().asCacheHit();
        }

        Optional<FallbackEntry> clip = findInLibrary(key, attemptCount);
        if (clip.isPresent()) {
            cache.put(key, clip.get());
            recordUsage(key, FallbackSource.LIBRARY);
            return clip.get();
        }

        String text;
        synchronized (random) {
            text = FallbackPhrases.select(issue.type(), key.language(), attemptCount, frustrationLevel, random);
        }
        Instant startedAt = Instant.now();
        try {
            byte[] audio = synthesis.synthesize(text, key.language(), VoiceOptions.defaults());
            FallbackEntry generated = new FallbackEntry(FallbackSource.GENERATED, audio, text, elapsedMs(startedAt));
            cache.put(key, generated);
            recordUsage(key, FallbackSource.GENERATED);
            return generated;
        } catch (Exception e) {
            log.warning("fallback.synthesis_failed key=" + key.asString() + " message=" + e.getMessage());
            recordUsage(key, FallbackSource.GENERATED);
            return new FallbackEntry(FallbackSource.GENERATED, new byte[0], text, elapsedMs(startedAt));
        }
    }

    private Optional<FallbackEntry> findInLibrary(FallbackKey key, int attemptCount) {
        try {
            return library.find(key.language(), key.issueType(), attemptCount);
        } catch (RuntimeException e) {
            log.warning("fallback.library_failed key=" + key.asString() + " message=" + e.getMessage());
            return Optional.empty();
        }
    }

    private void recordUsage(FallbackKey key, FallbackSource source) {
        usage.merge(key.asString(), FallbackUsage.empty().plus(source), (current, ignored) -> current.plus(source));
    }

    public Map<String, FallbackUsage> usageStats() {
        return new TreeMap<>(usage);
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
        log.info("fallback.cache_cleared");
    }

    private static long elapsedMs(Instant startedAt) {
        return Duration.between(startedAt, Instant.now()).toMillis();
    }
}
