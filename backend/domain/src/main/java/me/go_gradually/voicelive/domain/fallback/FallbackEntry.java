package me.go_gradually.voicelive.domain.fallback;

public record FallbackEntry(FallbackSource source, byte[] audio, String text, long latencyMs) {
    public FallbackEntry {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        audio = audio == null ? new byte[0] : audio;
        text = text == null ? "" : text;
    }

    public FallbackEntry asCacheHit() {
        return new FallbackEntry(FallbackSource.CACHE, audio, text, 0L);
    }

    public boolean hasAudio() {
        return audio.length > 0;
    }
}
