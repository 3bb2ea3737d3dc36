package me.go_gradually.voicelive.application.pipeline.model;

public record TranscriptionOptions(int sampleRate) {
}
