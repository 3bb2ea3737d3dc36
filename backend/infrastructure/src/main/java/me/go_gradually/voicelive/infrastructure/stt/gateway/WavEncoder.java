package me.go_gradually.voicelive.infrastructure.stt.gateway;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

final class WavEncoder {
    private static final int HEADER_BYTES = 44;
    private static final short PCM_FORMAT = 1;
    private static final short CHANNELS = 1;
    private static final short BITS_PER_SAMPLE = 16;

    private WavEncoder() {
    }

    /**
     * Wraps mono 16-bit PCM in a RIFF header so the transcription endpoint can detect the format.
     */
    static byte[] wrapPcm16(byte[] pcm, int sampleRate) {
        int blockAlign = CHANNELS * BITS_PER_SAMPLE / 8;
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(new byte[]{'R', 'I', 'F', 'F'});
        buffer.putInt(36 + pcm.length);
        buffer.put(new byte[]{'W', 'A', 'V', 'E'});
        buffer.put(new byte[]{'f', 'm', 't', ' '});
        buffer.putInt(16);
        buffer.putShort(PCM_FORMAT);
        buffer.putShort(CHANNELS);
        buffer.putInt(sampleRate);
        buffer.putInt(sampleRate * blockAlign);
        buffer.putShort((short) blockAlign);
        buffer.putShort(BITS_PER_SAMPLE);
        buffer.put(new byte[]{'d', 'a', 't', 'a'});
        buffer.putInt(pcm.length);
        buffer.put(pcm);
        return buffer.array();
    }
}
