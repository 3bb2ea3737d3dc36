package me.go_gradually.voicelive.application.pipeline.usecase;

import me.go_gradually.voicelive.application.fallback.usecase.FallbackResponseSelector;
import me.go_gradually.voicelive.application.interruption.usecase.InterruptionAwareResponder;
import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.model.SessionMode;
import me.go_gradually.voicelive.application.pipeline.model.PipelineResult;
import me.go_gradually.voicelive.application.pipeline.port.GenerationGateway;
import me.go_gradually.voicelive.application.pipeline.port.SpeechSynthesisGateway;
import me.go_gradually.voicelive.application.pipeline.port.TranscriptionGateway;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.application.support.MutableClock;
import me.go_gradually.voicelive.application.support.RecordingSink;
import me.go_gradually.voicelive.application.support.TestPolicies;
import me.go_gradually.voicelive.application.support.TestSessions;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackSource;
import me.go_gradually.voicelive.domain.interruption.InterruptionEvent;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.quality.Issue;
import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.domain.quality.RecommendedAction;
import me.go_gradually.voicelive.domain.quality.Severity;
import me.go_gradually.voicelive.domain.quality.TranscriptionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AudioPipelineOrchestratorTest {

    private static final byte[] AUDIO = new byte[]{1, 0, 2, 0};
    private static final String CLEAR_SPEECH = "I would like to check my account balance please";

    @Mock
    private TranscriptionGateway transcription;
    @Mock
    private SpeechSynthesisGateway synthesis;
    @Mock
    private GenerationGateway generation;
    @Mock
    private FallbackResponseSelector fallbackSelector;
    @Mock
    private MetricsPort metrics;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private AudioPipelineOrchestrator orchestrator;
    private LiveSession session;

    @BeforeEach
    void setUp() {
        InterruptionAwareResponder responder = new InterruptionAwareResponder(generation, new Random(1));
        orchestrator = new AudioPipelineOrchestrator(transcription, synthesis, responder, fallbackSelector,
                new TestPolicies(), metrics);
        session = TestSessions.session("s1", "en", SessionMode.PIPELINE, new RecordingSink(), clock);
    }

    @Test
    void processAudio_generatesAndSynthesizesReplyForClearSpeech() throws Exception {
        stubTranscript(CLEAR_SPEECH, 0.95);
        when(generation.generate(eq(CLEAR_SPEECH), any())).thenReturn("Your balance is 500 rupees.");
        when(synthesis.synthesize(eq("Your balance is 500 rupees."), eq("en"), any())).thenReturn(new byte[]{4, 4});

        PipelineResult result = orchestrator.processAudio(AUDIO, session);

        assertFalse(result.isFallback());
        assertEquals(RecommendedAction.CONTINUE, result.action());
        assertEquals(CLEAR_SPEECH, result.transcript());
        assertEquals("Your balance is 500 rupees.", result.text());
        assertArrayEquals(new byte[]{4, 4}, result.audio());
        assertEquals("Your balance is 500 rupees.", session.lastAiResponse());
        assertEquals(0, session.adaptive().attemptCount());
        verify(metrics).recordPipelineLatency(any());
        verify(fallbackSelector, never()).select(any(), anyString(), anyInt(), anyDouble());
    }

    @Test
    void processAudio_fallsBackOnLowConfidenceWithoutGenerating() throws Exception {
        stubTranscript("balance check", 0.2);
        when(fallbackSelector.select(any(), eq("en"), eq(1), anyDouble()))
                .thenReturn(new FallbackEntry(FallbackSource.LIBRARY, new byte[]{9}, "Could you say that again?", 3L));

        PipelineResult result = orchestrator.processAudio(AUDIO, session);

        assertTrue(result.isFallback());
        assertEquals(FallbackSource.LIBRARY, result.fallbackSource());
        assertEquals(RecommendedAction.REQUEST_REPEAT, result.action());
        assertEquals("Could you say that again?", result.text());
        ArgumentCaptor<Issue> issue = ArgumentCaptor.forClass(Issue.class);
        verify(fallbackSelector).select(issue.capture(), eq("en"), eq(1), anyDouble());
        assertEquals(IssueType.LOW_CONFIDENCE, issue.getValue().type());
        assertEquals(Severity.CRITICAL, issue.getValue().severity());
        verify(generation, never()).generate(anyString(), any());
        verify(metrics).incrementFallback();
    }

    @Test
    void processAudio_treatsTranscriptionFailureAsEmptyTranscript() throws Exception {
        when(transcription.transcribe(any(), anyString(), any())).thenThrow(new IllegalStateException("stt down"));
        when(fallbackSelector.select(any(), anyString(), anyInt(), anyDouble()))
                .thenReturn(new FallbackEntry(FallbackSource.GENERATED, new byte[0], "I didn't catch that.", 0L));

        PipelineResult result = orchestrator.processAudio(AUDIO, session);

        assertTrue(result.isFallback());
        assertEquals(IssueType.EMPTY_TRANSCRIPT, result.issues().get(0).type());
        assertEquals(1, session.adaptive().attemptCount());
    }

    @Test
    void processAudio_fallsBackWhenGenerationFails() throws Exception {
        stubTranscript(CLEAR_SPEECH, 0.95);
        when(generation.generate(anyString(), any())).thenThrow(new IllegalStateException("model overloaded"));
        when(fallbackSelector.select(any(), anyString(), anyInt(), anyDouble()))
                .thenReturn(new FallbackEntry(FallbackSource.CACHE, new byte[]{1}, "Sorry, please repeat.", 0L));

        PipelineResult result = orchestrator.processAudio(AUDIO, session);

        assertTrue(result.isFallback());
        assertEquals(RecommendedAction.REQUEST_REPEAT, result.action());
        ArgumentCaptor<Issue> issue = ArgumentCaptor.forClass(Issue.class);
        verify(fallbackSelector).select(issue.capture(), anyString(), anyInt(), anyDouble());
        assertEquals(IssueType.CONNECTION_ISSUE, issue.getValue().type());
        verify(synthesis, never()).synthesize(anyString(), anyString(), any());
    }

    @Test
    void processAudio_returnsTextOnlyWhenSynthesisFails() throws Exception {
        stubTranscript(CLEAR_SPEECH, 0.95);
        when(generation.generate(anyString(), any())).thenReturn("Here you go.");
        when(synthesis.synthesize(anyString(), anyString(), any())).thenThrow(new IllegalStateException("tts down"));

        PipelineResult result = orchestrator.processAudio(AUDIO, session);

        assertFalse(result.isFallback());
        assertEquals("Here you go.", result.text());
        assertEquals(0, result.audio().length);
    }

    @Test
    void processAudio_usesResumableInterruptionOnlyOnce() throws Exception {
        session.interruptions().save(
                new InterruptionEvent(InterruptionType.BARGE_IN, 0.5, "", 0.9, 0.5, clock.instant()),
                "Fixed deposits pay seven percent for a two year term with quarterly payouts");
        stubTranscript(CLEAR_SPEECH, 0.95);
        when(generation.generate(anyString(), any())).thenReturn("Sure.");
        when(synthesis.synthesize(anyString(), anyString(), any())).thenReturn(new byte[]{1});

        orchestrator.processAudio(AUDIO, session);
        orchestrator.processAudio(AUDIO, session);

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(generation, times(2)).generate(prompts.capture(), any());
        List<String> sent = prompts.getAllValues();
        assertTrue(sent.get(0).startsWith("[CONVERSATION CONTEXT]"));
        assertEquals(CLEAR_SPEECH, sent.get(1));
    }

    @Test
    void processAudio_acknowledgesLatestCorrectionOnce() throws Exception {
        session.interruptions().save(
                new InterruptionEvent(InterruptionType.CORRECTION, 0.5, "no, savings", 0.9, 0.5, clock.instant()),
                "Your current account balance is two thousand rupees as of today");
        stubTranscript(CLEAR_SPEECH, 0.95);
        when(generation.generate(anyString(), any())).thenReturn("Your savings balance is 500 rupees.");
        when(synthesis.synthesize(anyString(), anyString(), any())).thenReturn(new byte[]{1});

        PipelineResult first = orchestrator.processAudio(AUDIO, session);
        PipelineResult second = orchestrator.processAudio(AUDIO, session);

        List<String> english = List.of("Oh, I understand now. ", "You're right, ", "Got it - ", "I see, ");
        assertTrue(english.stream().anyMatch(first.text()::startsWith));
        assertEquals("Your savings balance is 500 rupees.", second.text());
    }

    private void stubTranscript(String transcript, double confidence) throws Exception {
        when(transcription.transcribe(any(), eq("en"), any()))
                .thenReturn(new TranscriptionResult(true, transcript, confidence, true, "en"));
    }
}
