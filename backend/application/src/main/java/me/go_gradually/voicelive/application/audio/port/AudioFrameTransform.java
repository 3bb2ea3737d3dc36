package me.go_gradually.voicelive.application.audio.port;

/**
 * Turns client audio into frames the upstream accepts.
 * Implementations throw {@link me.go_gradually.voicelive.application.shared.error.InvalidAudioFrameException}
 * for frames they cannot use.
 */
public interface AudioFrameTransform {
    byte[] toUpstreamFrame(byte[] rawFrame);

    byte[] decodeBase64(String encodedFrame);
}
