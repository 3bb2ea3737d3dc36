package me.go_gradually.voicelive.application.live.usecase;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.model.LiveTurnListener;
import me.go_gradually.voicelive.application.live.model.SessionMode;
import me.go_gradually.voicelive.application.live.model.ToolCall;
import me.go_gradually.voicelive.application.live.model.UpstreamSetup;
import me.go_gradually.voicelive.application.live.port.UpstreamAudioGateway;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.application.live.port.UpstreamEventListener;
import me.go_gradually.voicelive.application.shared.error.UpstreamConnectionException;
import me.go_gradually.voicelive.application.shared.error.UpstreamSetupException;
import me.go_gradually.voicelive.application.shared.port.DelayScheduler;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.application.support.MutableClock;
import me.go_gradually.voicelive.application.support.RecordingSink;
import me.go_gradually.voicelive.application.support.TestPolicies;
import me.go_gradually.voicelive.application.support.TestSessions;
import me.go_gradually.voicelive.domain.live.ToolResponseSanitizer;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;
import me.go_gradually.voicelive.domain.session.SessionPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpstreamConnectionManagerTest {

    @Mock
    private UpstreamAudioGateway gateway;
    @Mock
    private UpstreamChannel channel;
    @Mock
    private MetricsPort metrics;
    @Mock
    private LiveTurnListener turns;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final TestPolicies policies = new TestPolicies();
    private final RecordingSink sink = new RecordingSink();
    private final DelayScheduler inline = (task, delay) -> {
        task.run();
        return () -> {
        };
    };

    private UpstreamConnectionManager manager;
    private UpstreamEventListener listener;

    @BeforeEach
    void setUp() {
        manager = new UpstreamConnectionManager(gateway, policies, inline, metrics, clock);
    }

    @Test
    void open_failsWithConnectionErrorWhenConnectTimesOut() {
        policies.connectTimeoutMs = 50L;
        when(gateway.connect(any(), any())).thenReturn(new CompletableFuture<>());
        LiveSession session = session("en");

        assertThrows(UpstreamConnectionException.class, () -> manager.open(session, turns));

        verify(metrics).incrementHandshakeFailure();
        assertEquals(SessionPhase.CONNECTING, session.phase());
    }

    @Test
    void open_failsWithConnectionErrorWhenTransportRefuses() {
        when(gateway.connect(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("refused")));

        UpstreamConnectionException error = assertThrows(UpstreamConnectionException.class,
                () -> manager.open(session("en"), turns));

        assertTrue(error.getMessage().contains("refused"));
        assertTrue(error.isFatal());
    }

    @Test
    void open_failsWithSetupErrorWhenSetupIsNotAcknowledged() {
        policies.setupTimeoutMs = 50L;
        stubConnect();
        when(channel.setup(any())).thenReturn(new CompletableFuture<>());
        LiveSession session = session("en");

        assertThrows(UpstreamSetupException.class, () -> manager.open(session, turns));

        verify(channel).close();
        verify(metrics).incrementHandshakeFailure();
        verify(channel, never()).sendUserText(anyString());
        assertEquals(SessionPhase.HANDSHAKING, session.phase());
    }

    @Test
    void open_primesAndSuppressesGreetingReply() {
        stubConnect();
        when(channel.setup(any())).thenReturn(CompletableFuture.completedFuture(null));
        doAnswer(invocation -> {
            listener.onText("Hello! How can I help?");
            listener.onAudioChunk(new byte[]{1, 2});
            listener.onTurnComplete();
            return null;
        }).when(channel).sendUserText(anyString());
        LiveSession session = session("en");

        UpstreamChannel opened = manager.open(session, turns);

        assertSame(channel, opened);
        verify(channel).sendUserText(LocalizedPrompts.greeting("en"));
        assertTrue(sink.audio.isEmpty());
        verify(turns, never()).onTurnComplete(any());
        assertEquals("", session.currentResponseText());
        assertEquals(SessionPhase.ACTIVE, session.phase());
        verify(metrics).recordHandshakeLatency(any(Duration.class));
    }

    @Test
    void open_skipsPrimingForAutoLanguage() {
        stubConnect();
        when(channel.setup(any())).thenReturn(CompletableFuture.completedFuture(null));
        LiveSession session = session("auto");

        manager.open(session, turns);

        verify(channel, never()).sendUserText(anyString());
        ArgumentCaptor<UpstreamSetup> setup = ArgumentCaptor.forClass(UpstreamSetup.class);
        verify(channel).setup(setup.capture());
        assertNull(setup.getValue().languageCode());
        assertEquals(SessionPhase.ACTIVE, session.phase());
    }

    @Test
    void setupFor_usesRegionalLanguageAndPolicyValues() {
        LiveSession session = session("ta");
        session.appendToSystemInstruction("Be brief.");

        UpstreamSetup setup = manager.setupFor(session);

        assertEquals("ta-IN", setup.languageCode());
        assertEquals("Be brief.", setup.systemInstruction());
        assertEquals("Aoede", setup.voiceName());
        assertEquals(1024, setup.maxOutputTokens());
    }

    @Test
    void demultiplexer_forwardsAudioAndRecordsFirstAudioLatency() {
        LiveSession session = openSession();
        session.startTurn(clock.instant());
        clock.advance(Duration.ofMillis(400));

        listener.onAudioChunk(new byte[]{9, 9});
        listener.onAudioChunk(new byte[]{8});

        assertEquals(2, sink.audio.size());
        verify(metrics).recordFirstAudioLatency(Duration.ofMillis(400));
        assertEquals(400L, session.lastLatencyMs());
    }

    @Test
    void demultiplexer_sanitizesToolReplyAndAnswersTheCall() {
        LiveSession session = openSession();
        String raw = "**Sure**, your balance is (approx) 500 rupees";

        listener.onToolCall(new ToolCall("call-1", UpstreamConnectionManager.RESPONSE_TOOL, Map.of("response", raw)));

        String expected = ToolResponseSanitizer.sanitize(raw);
        verify(channel).sendToolResponse("call-1", UpstreamConnectionManager.RESPONSE_TOOL, expected);
        assertEquals(expected, session.currentResponseText());
    }

    @Test
    void demultiplexer_routesTurnEventsToListener() {
        LiveSession session = openSession();

        listener.onTurnComplete();
        listener.onInterrupted();
        listener.onClosed(1011, "internal");

        verify(turns).onTurnComplete(session);
        verify(turns).onInterrupted(session);
        verify(turns).onUpstreamClosed(eq(session), eq("internal"));
    }

    @Test
    void demultiplexer_ignoresEventsAfterClose() {
        LiveSession session = openSession();
        session.markClosed();

        listener.onAudioChunk(new byte[]{1});
        listener.onTurnComplete();
        listener.onClosed(1000, "bye");

        assertTrue(sink.audio.isEmpty());
        verify(turns, never()).onTurnComplete(any());
        verify(turns, never()).onUpstreamClosed(any(), anyString());
    }

    private LiveSession openSession() {
        stubConnect();
        when(channel.setup(any())).thenReturn(CompletableFuture.completedFuture(null));
        LiveSession session = session("auto");
        manager.open(session, turns);
        return session;
    }

    private void stubConnect() {
        when(gateway.connect(any(), any())).thenAnswer(invocation -> {
            listener = invocation.getArgument(1);
            return CompletableFuture.completedFuture(channel);
        });
    }

    private LiveSession session(String language) {
        return TestSessions.session("s1", language, SessionMode.NATIVE, sink, clock);
    }
}
