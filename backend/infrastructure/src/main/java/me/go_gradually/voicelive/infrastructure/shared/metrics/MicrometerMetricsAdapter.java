package me.go_gradually.voicelive.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordHandshakeLatency(Duration duration) {
        record("live.handshake.latency", duration);
    }

    @Override
    public void recordFirstAudioLatency(Duration duration) {
        record("live.upstream.first_audio.latency", duration);
    }

    @Override
    public void recordTranscriptionLatency(Duration duration) {
        record("pipeline.transcription.latency", duration);
    }

    @Override
    public void recordGenerationLatency(Duration duration) {
        record("pipeline.generation.latency", duration);
    }

    @Override
    public void recordSynthesisLatency(Duration duration) {
        record("pipeline.synthesis.latency", duration);
    }

    @Override
    public void recordPipelineLatency(Duration duration) {
        record("pipeline.total.latency", duration);
    }

    @Override
    public void incrementSessionOpened() {
        meterRegistry.counter("live.sessions.opened").increment();
    }

    @Override
    public void incrementSessionClosed() {
        meterRegistry.counter("live.sessions.closed").increment();
    }

    @Override
    public void incrementHandshakeFailure() {
        meterRegistry.counter("live.handshake.failures").increment();
    }

    @Override
    public void incrementFallback() {
        meterRegistry.counter("pipeline.fallbacks").increment();
    }

    @Override
    public void incrementDroppedFlush() {
        meterRegistry.counter("pipeline.flushes.dropped").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
