package me.go_gradually.voicelive.application.pipeline.model;

public record GenerationOptions(String systemInstruction, int maxTokens) {
}
