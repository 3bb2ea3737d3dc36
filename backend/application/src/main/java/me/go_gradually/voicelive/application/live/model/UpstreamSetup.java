package me.go_gradually.voicelive.application.live.model;

/**
 * Generation settings carried by the setup message.
 *
 * @param languageCode regional code, or {@code null} to let the upstream detect the language
 */
public record UpstreamSetup(String systemInstruction,
                            String languageCode,
                            String voiceName,
                            double temperature,
                            int maxOutputTokens,
                            double vadSilenceSeconds) {
}
