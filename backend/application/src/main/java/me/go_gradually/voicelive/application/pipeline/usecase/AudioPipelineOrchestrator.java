package me.go_gradually.voicelive.application.pipeline.usecase;

import me.go_gradually.voicelive.application.fallback.usecase.FallbackResponseSelector;
import me.go_gradually.voicelive.application.interruption.model.ResponderReply;
import me.go_gradually.voicelive.application.interruption.model.ResponderRequest;
import me.go_gradually.voicelive.application.interruption.usecase.InterruptionAwareResponder;
import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.pipeline.model.LatencyBreakdown;
import me.go_gradually.voicelive.application.pipeline.model.PipelineResult;
import me.go_gradually.voicelive.application.pipeline.model.TranscriptionOptions;
import me.go_gradually.voicelive.application.pipeline.model.VoiceOptions;
import me.go_gradually.voicelive.application.pipeline.policy.PipelinePolicy;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.application.pipeline.port.TranscriptionGateway;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.domain.adaptive.AdaptiveProfileManager;
import me.go_gradually.voicelive.domain.adaptive.ResponseSettings;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.quality.ConversationQualityAnalyzer;
import me.go_gradually.voicelive.domain.quality.Issue;
import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.domain.quality.RecommendedAction;
import me.go_gradually.voicelive.domain.quality.Severity;
import me.go_gradually.voicelive.domain.quality.TranscriptionResult;

import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Transcribe, check quality, generate, synthesize. Quality problems and generation failures end in a fallback reply.
 */
public class AudioPipelineOrchestrator {
    private static final Logger log = Logger.getLogger(AudioPipelineOrchestrator.class.getName());

    private final TranscriptionGateway transcription;
    private final SpeechSynthesisGateway synthesis;
    private final InterruptionAwareResponder responder;
    private final FallbackResponseSelector fallbackSelector;
    private final PipelinePolicy policy;
    private final MetricsPort metrics;

    public AudioPipelineOrchestrator(TranscriptionGateway transcription,
                                     SpeechSynthesisGateway synthesis,
                                     InterruptionAwareResponder responder,
                                     FallbackResponseSelector fallbackSelector,
                                     PipelinePolicy policy,
                                     MetricsPort metrics) {
        this.transcription = transcription;
        this.synthesis = synthesis;
        this.responder = responder;
        this.fallbackSelector = fallbackSelector;
        this.policy = policy;
        this.metrics = metrics;
    }

    public PipelineResult processAudio(byte[] audio, LiveSession session) {
        long startedAt = System.nanoTime();
        String sessionId = session.id().value();
        String language = session.language();

        TranscriptionResult result;
        long transcribeStartedAt = System.nanoTime();
        try {
            result = transcription.transcribe(audio, language, new TranscriptionOptions(policy.sampleRate()));
            if (result == null) {
                result = TranscriptionResult.failed();
            }
        } catch (Exception e) {
            log.warning("pipeline.transcription_failed sessionId=" + sessionId + " message=" + e.getMessage());
            result = TranscriptionResult.failed();
        }
        long transcriptionMs = elapsedMs(transcribeStartedAt);
        metrics.recordTranscriptionLatency(Duration.ofMillis(transcriptionMs));

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, language);
        RecommendedAction action = ConversationQualityAnalyzer.recommendedAction(issues);
        AdaptiveProfileManager adaptive = session.adaptive();
        Issue primary = ConversationQualityAnalyzer.primaryIssue(issues);
        if (primary != null) {
            adaptive.recordIssue(primary);
        }
        if (action.requiresFallback()) {
            log.info(() -> "pipeline.quality_fallback sessionId=" + sessionId + " action=" + action + " issue=" + primary.type());
            return fallback(session, result.transcript(), primary, action, issues, startedAt, transcriptionMs, 0L);
        }

        ResponseSettings settings = adaptive.responseSettings();
        InterruptionContext context = session.consumeResumableInterruption();
        InterruptionType interruption = session.consumeLatestInterruption();
        long generateStartedAt = System.nanoTime();
        ResponderReply reply;
        try {
            reply = responder.respond(new ResponderRequest(
                    result.transcript(), context, interruption, language, settings, session.systemInstruction()));
        } catch (Exception e) {
            log.warning("pipeline.generation_failed sessionId=" + sessionId + " message=" + e.getMessage());
            long generationMs = elapsedMs(generateStartedAt);
            Issue connectionIssue = new Issue(IssueType.CONNECTION_ISSUE, Severity.HIGH, result.transcript(),
                    result.confidence(), "Generation failed");
            adaptive.recordIssue(connectionIssue);
            return fallback(session, result.transcript(), connectionIssue, RecommendedAction.REQUEST_REPEAT,
                    issues, startedAt, transcriptionMs, generationMs);
        }
        long generationMs = elapsedMs(generateStartedAt);
        metrics.recordGenerationLatency(Duration.ofMillis(generationMs));

        String spoken = reply.spokenText();
        long synthesizeStartedAt = System.nanoTime();
        byte[] speech = new byte[0];
        try {
            speech = synthesis.synthesize(spoken, language, VoiceOptions.defaults());
        } catch (Exception e) {
            log.warning("pipeline.synthesis_failed sessionId=" + sessionId + " message=" + e.getMessage());
        }
        long synthesisMs = elapsedMs(synthesizeStartedAt);
        metrics.recordSynthesisLatency(Duration.ofMillis(synthesisMs));

        long totalMs = elapsedMs(startedAt);
        metrics.recordPipelineLatency(Duration.ofMillis(totalMs));
        session.recordAiResponse(spoken);
        return new PipelineResult(result.transcript(), spoken, speech, action, issues, null,
                new LatencyBreakdown(totalMs, transcriptionMs, generationMs, synthesisMs));
    }

    private PipelineResult fallback(LiveSession session,
                                    String transcript,
                                    Issue issue,
                                    RecommendedAction action,
                                    List<Issue> issues,
                                    long startedAt,
                                    long transcriptionMs,
                                    long generationMs) {
        AdaptiveProfileManager adaptive = session.adaptive();
        FallbackEntry entry = fallbackSelector.select(issue, session.language(),
                adaptive.attemptCount(), adaptive.frustrationLevel());
        metrics.incrementFallback();
        long totalMs = elapsedMs(startedAt);
        metrics.recordPipelineLatency(Duration.ofMillis(totalMs));
        return new PipelineResult(transcript, entry.text(), entry.audio(), action, issues, entry.source(),
                new LatencyBreakdown(totalMs, transcriptionMs, generationMs, entry.latencyMs()));
    }

    private static long elapsedMs(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos).toMillis();
    }
}
