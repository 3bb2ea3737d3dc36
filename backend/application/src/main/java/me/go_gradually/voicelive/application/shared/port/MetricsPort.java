package me.go_gradually.voicelive.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordHandshakeLatency(Duration duration);

    void recordFirstAudioLatency(Duration duration);

    void recordTranscriptionLatency(Duration duration);

    void recordGenerationLatency(Duration duration);

    void recordSynthesisLatency(Duration duration);

    void recordPipelineLatency(Duration duration);

    void incrementSessionOpened();

    void incrementSessionClosed();

    void incrementHandshakeFailure();

    void incrementFallback();

    void incrementDroppedFlush();
}
