package me.go_gradually.voicelive.application.pipeline.model;

import me.go_gradually.voicelive.domain.fallback.FallbackSource;
import me.go_gradually.voicelive.domain.quality.Issue;
import me.go_gradually.voicelive.domain.quality.RecommendedAction;

import java.util.List;

/**
 * @param fallbackSource tier that produced the reply, or {@code null} when the reply was generated normally
 */
public record PipelineResult(String transcript,
                             String text,
                             byte[] audio,
                             RecommendedAction action,
                             List<Issue> issues,
                             FallbackSource fallbackSource,
                             LatencyBreakdown latency) {
    public PipelineResult {
        transcript = transcript == null ? "" : transcript;
        text = text == null ? "" : text;
        audio = audio == null ? new byte[0] : audio;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean isFallback() {
        return fallbackSource != null;
    }
}
