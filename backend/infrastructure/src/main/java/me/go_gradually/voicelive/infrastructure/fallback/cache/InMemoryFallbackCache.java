package me.go_gradually.voicelive.infrastructure.fallback.cache;

import me.go_gradually.voicelive.application.fallback.port.FallbackCachePort;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackKey;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryFallbackCache implements FallbackCachePort {
    private final Map<FallbackKey, FallbackEntry> entries = new ConcurrentHashMap<>();

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
