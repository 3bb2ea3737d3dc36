package me.go_gradually.voicelive.application.fallback.usecase;

import me.go_gradually.voicelive.application.fallback.port.FallbackCachePort;
import me.go_gradually.voicelive.application.fallback.port.FallbackLibraryPort;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackKey;
import me.go_gradually.voicelive.domain.fallback.FallbackPhrases;
import me.go_gradually.voicelive.domain.fallback.FallbackSource;
import me.go_gradually.voicelive.domain.fallback.FallbackUsage;
import me.go_gradually.voicelive.domain.quality.Issue;
import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.domain.quality.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FallbackResponseSelectorTest {

    @Mock
    private FallbackLibraryPort library;
    @Mock
    private SpeechSynthesisGateway synthesis;

    private MapCache cache;
    private FallbackResponseSelector selector;

    private final Issue lowConfidence = Issue.of(IssueType.LOW_CONFIDENCE, Severity.CRITICAL);

    @BeforeEach
    void setUp() {
        cache = new MapCache();
        selector = new FallbackResponseSelector(cache, library, synthesis, new Random(7));
    }

    @Test
    void select_returnsCachedEntryWithZeroLatency() {
        FallbackKey key = new FallbackKey("en", IssueType.LOW_CONFIDENCE, Severity.CRITICAL);
        cache.put(key, new FallbackEntry(FallbackSource.GENERATED, new byte[]{1, 2, 3}, "Could you repeat that?", 420L));

        FallbackEntry entry = selector.select(lowConfidence, "en-IN", 1, 0.2);

        assertEquals(FallbackSource.CACHE, entry.source());
        assertEquals(0L, entry.latencyMs());
        assertArrayEquals(new byte[]{1, 2, 3}, entry.audio());
        verifyNoInteractions(library, synthesis);
    }

    @Test
    void select_cachesLibraryClip() throws Exception {
        FallbackEntry clip = new FallbackEntry(FallbackSource.LIBRARY, new byte[]{5}, "Please say that again", 12L);
        when(library.find("hi", IssueType.LOW_CONFIDENCE, 2)).thenReturn(Optional.of(clip));

        FallbackEntry entry = selector.select(lowConfidence, "hi", 2, 0.1);

        assertEquals(FallbackSource.LIBRARY, entry.source());
        assertTrue(cache.get(new FallbackKey("hi", IssueType.LOW_CONFIDENCE, Severity.CRITICAL)).isPresent());
        verify(synthesis, never()).synthesize(anyString(), anyString(), any());

        FallbackEntry second = selector.select(lowConfidence, "hi", 3, 0.1);
        assertEquals(FallbackSource.CACHE, second.source());
    }

    @Test
    void select_synthesizesLocalizedPhraseWhenNothingStored() throws Exception {
        when(library.find(anyString(), any(), anyInt())).thenReturn(Optional.empty());
        when(synthesis.synthesize(anyString(), eq("en"), any())).thenReturn(new byte[]{7, 7});

        FallbackEntry entry = selector.select(lowConfidence, "en", 1, 0.0);

        assertEquals(FallbackSource.GENERATED, entry.source());
        assertTrue(FallbackPhrases.templates("en", IssueType.LOW_CONFIDENCE).contains(entry.text()));
        assertTrue(entry.hasAudio());
        assertEquals(1, cache.size());
    }

    @Test
    void select_returnsTextOnlyWhenSynthesisFails() throws Exception {
        when(library.find(anyString(), any(), anyInt())).thenReturn(Optional.empty());
        when(synthesis.synthesize(anyString(), anyString(), any())).thenThrow(new IllegalStateException("tts down"));

        FallbackEntry entry = selector.select(lowConfidence, "en", 1, 0.0);

        assertEquals(FallbackSource.GENERATED, entry.source());
        assertFalse(entry.hasAudio());
        assertFalse(entry.text().isBlank());
        assertEquals(0, cache.size());
    }

    @Test
    void select_treatsLibraryFailureAsMiss() throws Exception {
        when(library.find(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("disk"));
        when(synthesis.synthesize(anyString(), anyString(), any())).thenReturn(new byte[]{1});

        FallbackEntry entry = selector.select(lowConfidence, "en", 1, 0.0);

        assertEquals(FallbackSource.GENERATED, entry.source());
    }

    @Test
    void usageStats_countsEachTierPerKey() throws Exception {
        when(library.find(anyString(), any(), anyInt())).thenReturn(Optional.empty());
        when(synthesis.synthesize(anyString(), anyString(), any())).thenReturn(new byte[]{1});

        selector.select(lowConfidence, "en", 1, 0.0);
        selector.select(lowConfidence, "en", 2, 0.0);
        selector.select(lowConfidence, "en", 3, 0.0);

        FallbackUsage usage = selector.usageStats().get("en:LOW_CONFIDENCE:critical");
        assertEquals(1, usage.generated());
        assertEquals(2, usage.cache());
        assertEquals(3, usage.total());

        selector.clearCache();
        assertEquals(0, selector.cacheSize());
    }

    private static final class MapCache implements FallbackCachePort {
        private final Map<FallbackKey, FallbackEntry> entries = new HashMap<>();

        @Override
        public Optional<FallbackEntry> get(FallbackKey key) {
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public void put(FallbackKey key, FallbackEntry entry) {
            entries.put(key, entry);
        }

        @Override
        public int size() {
            return entries.size();
        }

        @Override
        public void clear() {
            entries.clear();
        }
    }
}
