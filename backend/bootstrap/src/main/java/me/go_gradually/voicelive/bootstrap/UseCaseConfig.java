package me.go_gradually.voicelive.bootstrap;

import me.go_gradually.voicelive.application.audio.port.AudioFrameTransform;
import me.go_gradually.voicelive.application.conversation.policy.ConversationPolicy;
import me.go_gradually.voicelive.application.fallback.port.FallbackCachePort;
import me.go_gradually.voicelive.application.fallback.port.FallbackLibraryPort;
import me.go_gradually.voicelive.application.fallback.usecase.FallbackResponseSelector;
import me.go_gradually.voicelive.application.history.port.ConversationHistoryPort;
import me.go_gradually.voicelive.application.interruption.usecase.InterruptionAwareResponder;
import me.go_gradually.voicelive.application.live.policy.UpstreamPolicy;
import me.go_gradually.voicelive.application.live.port.UpstreamAudioGateway;
import me.go_gradually.voicelive.application.live.usecase.LiveVoiceUseCase;
import me.go_gradually.voicelive.application.live.usecase.UpstreamConnectionManager;
import me.go_gradually.voicelive.application.pipeline.policy.PipelinePolicy;
import me.go_gradually.voicelive.application.pipeline.port.GenerationGateway;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.application.pipeline.port.TranscriptionGateway;
import me.go_gradually.voicelive.application.pipeline.usecase.AudioPipelineOrchestrator;
import me.go_gradually.voicelive.application.session.policy.LifecyclePolicy;
import me.go_gradually.voicelive.application.session.port.LiveSessionRegistry;
import me.go_gradually.voicelive.application.session.usecase.SessionLifecycleSupervisor;
import me.go_gradually.voicelive.application.shared.error.ClientErrorFormatter;
import me.go_gradually.voicelive.application.shared.error.ErrorDisclosurePolicy;
import me.go_gradually.voicelive.application.shared.port.AsyncExecutor;
import me.go_gradually.voicelive.application.shared.port.DelayScheduler;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.application.tracing.port.TracingPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class UseCaseConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new Random();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService liveExecutorService() {
        return Executors.newCachedThreadPool(namedThreads("live-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService liveScheduler() {
        return Executors.newScheduledThreadPool(2, namedThreads("live-timer-"));
    }

    @Bean
    public AsyncExecutor asyncExecutor(@Qualifier("liveExecutorService") ExecutorService liveExecutorService) {
        return liveExecutorService::execute;
    }

    @Bean
    public DelayScheduler delayScheduler(@Qualifier("liveScheduler") ScheduledExecutorService liveScheduler) {
        return (task, delay) -> {
            ScheduledFuture<?> future = liveScheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        };
    }

    @Bean
    public ClientErrorFormatter clientErrorFormatter(ErrorDisclosurePolicy errorDisclosurePolicy) {
        return new ClientErrorFormatter(errorDisclosurePolicy);
    }

    @Bean
    public InterruptionAwareResponder interruptionAwareResponder(GenerationGateway generationGateway, Random random) {
        return new InterruptionAwareResponder(generationGateway, random);
    }

    @Bean
    public FallbackResponseSelector fallbackResponseSelector(FallbackCachePort fallbackCachePort,
                                                             FallbackLibraryPort fallbackLibraryPort,
                                                             SpeechSynthesisGateway speechSynthesisGateway,
                                                             Random random) {
        return new FallbackResponseSelector(fallbackCachePort, fallbackLibraryPort, speechSynthesisGateway, random);
    }

    @Bean
    public AudioPipelineOrchestrator audioPipelineOrchestrator(TranscriptionGateway transcriptionGateway,
                                                               SpeechSynthesisGateway speechSynthesisGateway,
                                                               InterruptionAwareResponder interruptionAwareResponder,
                                                               FallbackResponseSelector fallbackResponseSelector,
                                                               PipelinePolicy pipelinePolicy,
                                                               MetricsPort metricsPort) {
        return new AudioPipelineOrchestrator(transcriptionGateway, speechSynthesisGateway, interruptionAwareResponder,
                fallbackResponseSelector, pipelinePolicy, metricsPort);
    }

    @Bean
    public UpstreamConnectionManager upstreamConnectionManager(UpstreamAudioGateway upstreamAudioGateway,
                                                               UpstreamPolicy upstreamPolicy,
                                                               DelayScheduler delayScheduler,
                                                               MetricsPort metricsPort,
                                                               Clock clock) {
        return new UpstreamConnectionManager(upstreamAudioGateway, upstreamPolicy, delayScheduler, metricsPort, clock);
    }

    @Bean
    public LiveVoiceUseCase liveVoiceUseCase(LiveSessionRegistry liveSessionRegistry,
                                             UpstreamConnectionManager upstreamConnectionManager,
                                             AudioPipelineOrchestrator audioPipelineOrchestrator,
                                             AudioFrameTransform audioFrameTransform,
                                             ConversationHistoryPort conversationHistoryPort,
                                             TracingPort tracingPort,
                                             AsyncExecutor asyncExecutor,
                                             ConversationPolicy conversationPolicy,
                                             PipelinePolicy pipelinePolicy,
                                             ClientErrorFormatter clientErrorFormatter,
                                             MetricsPort metricsPort,
                                             Clock clock) {
        return new LiveVoiceUseCase(liveSessionRegistry, upstreamConnectionManager, audioPipelineOrchestrator,
                audioFrameTransform, conversationHistoryPort, tracingPort, asyncExecutor, conversationPolicy,
                pipelinePolicy, clientErrorFormatter, metricsPort, clock);
    }

    @Bean
    public SessionLifecycleSupervisor sessionLifecycleSupervisor(LiveSessionRegistry liveSessionRegistry,
                                                                 LifecyclePolicy lifecyclePolicy,
                                                                 DelayScheduler delayScheduler,
                                                                 LiveVoiceUseCase liveVoiceUseCase,
                                                                 Clock clock) {
        return new SessionLifecycleSupervisor(liveSessionRegistry, lifecyclePolicy, delayScheduler,
                liveVoiceUseCase::closeSession, clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
