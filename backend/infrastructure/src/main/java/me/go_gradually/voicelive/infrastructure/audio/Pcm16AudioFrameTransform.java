package me.go_gradually.voicelive.infrastructure.audio;

import me.go_gradually.voicelive.application.audio.port.AudioFrameTransform;
import me.go_gradually.voicelive.application.shared.error.InvalidAudioFrameException;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Accepts 16-bit little-endian mono PCM, which is also what the upstream expects, so valid frames pass through unchanged.
 */
@Component
public class Pcm16AudioFrameTransform implements AudioFrameTransform {
    private final int maxFrameBytes;

    public Pcm16AudioFrameTransform(AppProperties properties) {
        this(properties.getPipeline().getMaxFrameBytes());
    }

    Pcm16AudioFrameTransform(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    public byte[] toUpstreamFrame(byte[] rawFrame) {
        if (rawFrame == null || rawFrame.length == 0) {
            throw new InvalidAudioFrameException("Audio frame is empty");
        }
        if (rawFrame.length % 2 != 0) {
            throw new InvalidAudioFrameException("PCM16 frame has odd length " + rawFrame.length);
        }
        if (rawFrame.length > maxFrameBytes) {
            throw new InvalidAudioFrameException("Audio frame of " + rawFrame.length + " bytes exceeds " + maxFrameBytes);
        }
        return rawFrame;
    }

    @Override
    public byte[] decodeBase64(String encodedFrame) {
        if (encodedFrame == null || encodedFrame.isBlank()) {
            throw new InvalidAudioFrameException("Audio payload is empty");
        }
        try {
            return Base64.getDecoder().decode(encodedFrame.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioFrameException("Audio payload is not valid base64", e);
        }
    }
}
