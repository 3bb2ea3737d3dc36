package me.go_gradually.voicelive.application.pipeline.policy;

public interface PipelinePolicy {
    long bufferDurationMs();

    int bufferMaxBytes();

    int sampleRate();

    int maxPendingFlushes();

    boolean nativeModeByDefault();
}
