package me.go_gradually.voicelive.domain.fallback;

public record FallbackUsage(long cache, long library, long generated) {
    public static FallbackUsage empty() {
        return new FallbackUsage(0, 0, 0);
    }

    public FallbackUsage plus(FallbackSource source) {
        return switch (source) {
            case CACHE -> new FallbackUsage(cache + 1, library, generated);
            case LIBRARY -> new FallbackUsage(cache, library + 1, generated);
            case GENERATED -> new FallbackUsage(cache, library, generated + 1);
        };
    }

    public long total() {
        return cache + library + generated;
    }
}
