package me.go_gradually.voicelive.application.pipeline.port;

import me.go_gradually.voicelive.application.pipeline.model.GenerationOptions;

public interface GenerationGateway {
    String generate(String prompt, GenerationOptions options) throws Exception;
}
