package me.go_gradually.voicelive.domain.audio;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Collects audio frames into one transcription unit.
 * A unit is released once the first buffered frame is older than the duration limit
 * or the buffered size reaches the byte ceiling.
 */
public class AudioAccumulator {
    private final Duration maxDuration;
    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Instant startedAt;

    public AudioAccumulator(Duration maxDuration, int maxBytes) {
        if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxDuration = maxDuration;
        this.maxBytes = maxBytes;
    }

    public synchronized Optional<byte[]> append(byte[] frame, Instant now) {
        if (frame == null || frame.length == 0) {
            return Optional.empty();
        }
        if (startedAt == null) {
            startedAt = now;
        }
        buffer.write(frame, 0, frame.length);
        boolean full = buffer.size() >= maxBytes;
        boolean expired = Duration.between(startedAt, now).compareTo(maxDuration) >= 0;
        if (full || expired) {
            return Optional.of(drain());
        }
        return Optional.empty();
    }

    /**
     * Releases whatever is buffered, possibly an empty array.
     */
    public synchronized byte[] drain() {
        byte[] bytes = buffer.toByteArray();
        buffer.reset();
        startedAt = null;
        return bytes;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized boolean isEmpty() {
        return buffer.size() == 0;
    }
}
