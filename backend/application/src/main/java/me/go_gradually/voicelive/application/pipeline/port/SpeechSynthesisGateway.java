package me.go_gradually.voicelive.application.pipeline.port;

import me.go_gradually.voicelive.application.pipeline.model.VoiceOptions;

public interface SpeechSynthesisGateway {
    byte[] synthesize(String text, String language, VoiceOptions voice) throws Exception;
}
