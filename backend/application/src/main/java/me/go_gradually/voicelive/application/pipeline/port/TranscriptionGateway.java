package me.go_gradually.voicelive.application.pipeline.port;

import me.go_gradually.voicelive.application.pipeline.model.TranscriptionOptions;
import me.go_gradually.voicelive.domain.quality.TranscriptionResult;

public interface TranscriptionGateway {
    TranscriptionResult transcribe(byte[] audio, String language, TranscriptionOptions options) throws Exception;
}
