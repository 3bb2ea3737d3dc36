package me.go_gradually.voicelive.application.pipeline.model;

public record LatencyBreakdown(long totalMs, long transcriptionMs, long generationMs, long synthesisMs) {
}
