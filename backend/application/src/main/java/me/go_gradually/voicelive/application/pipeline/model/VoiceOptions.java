package me.go_gradually.voicelive.application.pipeline.model;

/**
 * @param voice provider voice name, or {@code null} for the configured default
 */
public record VoiceOptions(String voice) {
    public static VoiceOptions defaults() {
        return new VoiceOptions(null);
    }
}
