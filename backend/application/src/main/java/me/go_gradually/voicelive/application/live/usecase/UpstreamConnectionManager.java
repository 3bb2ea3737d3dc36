package me.go_gradually.voicelive.application.live.usecase;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.live.model.LiveTurnListener;
import me.go_gradually.voicelive.application.live.model.ToolCall;
import me.go_gradually.voicelive.application.live.model.UpstreamOpenCommand;
import me.go_gradually.voicelive.application.live.model.UpstreamSetup;
import me.go_gradually.voicelive.application.live.policy.UpstreamPolicy;
import me.go_gradually.voicelive.application.live.port.UpstreamAudioGateway;
import me.go_gradually.voicelive.application.live.port.UpstreamChannel;
import me.go_gradually.voicelive.application.live.port.UpstreamEventListener;
import me.go_gradually.voicelive.application.shared.error.UpstreamConnectionException;
import me.go_gradually.voicelive.application.shared.error.UpstreamSetupException;
import me.go_gradually.voicelive.application.shared.port.DelayScheduler;
import me.go_gradually.voicelive.application.shared.port.MetricsPort;
import me.go_gradually.voicelive.domain.live.LiveLanguageCodes;
import me.go_gradually.voicelive.domain.live.ToolResponseSanitizer;
import me.go_gradually.voicelive.domain.live.UsageCounters;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;
import me.go_gradually.voicelive.domain.session.SessionPhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Opens the upstream channel for a session and routes what comes back.
 * The connect wait, the setup wait and the priming settle delay are the only blocking steps, each bounded.
 */
public class UpstreamConnectionManager {
    static final String RESPONSE_TOOL = "respond_to_financial_query";
    private static final Logger log = Logger.getLogger(UpstreamConnectionManager.class.getName());
    private static final long PRIMING_WAIT_SLACK_MS = 1000L;

    private final UpstreamAudioGateway gateway;
    private final UpstreamPolicy policy;
    private final DelayScheduler delayScheduler;
    private final MetricsPort metrics;
    private final Clock clock;

    public UpstreamConnectionManager(UpstreamAudioGateway gateway,
                                     UpstreamPolicy policy,
                                     DelayScheduler delayScheduler,
                                     MetricsPort metrics,
                                     Clock clock) {
        this.gateway = gateway;
        this.policy = policy;
        this.delayScheduler = delayScheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    public UpstreamChannel open(LiveSession session, LiveTurnListener turns) {
        Instant startedAt = clock.instant();
        String sessionId = session.id().value();
        UpstreamChannel channel = connect(session, turns);
        session.attachChannel(channel);
        session.transition(SessionPhase.HANDSHAKING);
        awaitSetup(session, channel);
        metrics.recordHandshakeLatency(Duration.between(startedAt, clock.instant()));
        log.info(() -> "live.upstream.ready sessionId=" + sessionId + " language=" + session.language());

        prime(session, channel);
        session.transition(SessionPhase.ACTIVE);
        return channel;
    }

    private UpstreamChannel connect(LiveSession session, LiveTurnListener turns) {
        CompletableFuture<UpstreamChannel> connecting =
                gateway.connect(new UpstreamOpenCommand(session.id().value()), new Demultiplexer(session, turns));
        long timeoutMs = policy.upstreamConnectTimeoutMs();
        try {
            return connecting.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            connecting.cancel(true);
            metrics.incrementHandshakeFailure();
            throw new UpstreamConnectionException("Upstream connection timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            metrics.incrementHandshakeFailure();
            throw new UpstreamConnectionException("Upstream connection failed: " + causeMessage(e), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.incrementHandshakeFailure();
            throw new UpstreamConnectionException("Interrupted while connecting upstream", e);
        }
    }

    private void awaitSetup(LiveSession session, UpstreamChannel channel) {
        long timeoutMs = policy.upstreamSetupTimeoutMs();
        try {
            channel.setup(setupFor(session)).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            failSetup(channel);
            throw new UpstreamSetupException("Upstream setup was not acknowledged within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            failSetup(channel);
            throw new UpstreamSetupException("Upstream setup failed: " + causeMessage(e), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failSetup(channel);
            throw new UpstreamSetupException("Interrupted while waiting for upstream setup", e);
        } catch (RuntimeException e) {
            failSetup(channel);
            throw new UpstreamSetupException("Upstream setup could not be sent: " + e.getMessage(), e);
        }
    }

    private void failSetup(UpstreamChannel channel) {
        metrics.incrementHandshakeFailure();
        channel.close();
    }

    UpstreamSetup setupFor(LiveSession session) {
        return new UpstreamSetup(
                session.systemInstruction(),
                LiveLanguageCodes.regionalCode(session.language()),
                policy.upstreamVoiceName(),
                policy.upstreamTemperature(),
                policy.upstreamMaxOutputTokens(),
                policy.upstreamVadSilenceSeconds()
        );
    }

    // 인사말에 대한 응답은 클라이언트로 내보내지 않고 버린다.
    private void prime(LiveSession session, UpstreamChannel channel) {
        if (LiveLanguageCodes.isAuto(session.language())) {
            log.fine(() -> "live.upstream.priming_skipped sessionId=" + session.id().value());
            return;
        }
        if (!session.transition(SessionPhase.PRIMING)) {
            return;
        }
        channel.sendUserText(LocalizedPrompts.greeting(session.language()));

        long settleMs = policy.upstreamPrimingSettleMs();
        CompletableFuture<Void> settled = new CompletableFuture<>();
        DelayScheduler.Cancellable timer = delayScheduler.schedule(() -> settled.complete(null), Duration.ofMillis(settleMs));
        try {
            settled.get(settleMs + PRIMING_WAIT_SLACK_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            timer.cancel();
            log.warning("live.upstream.priming_wait_expired sessionId=" + session.id().value());
        } catch (InterruptedException e) {
            timer.cancel();
            Thread.currentThread().interrupt();
            throw new UpstreamSetupException("Interrupted while priming upstream", e);
        } finally {
            session.discardResponse();
        }
    }

    private static String causeMessage(ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private final class Demultiplexer implements UpstreamEventListener {
        private final LiveSession session;
        private final LiveTurnListener turns;

        private Demultiplexer(LiveSession session, LiveTurnListener turns) {
            this.session = session;
            this.turns = turns;
        }

        @Override
        public void onAudioChunk(byte[] audio) {
            if (session.isClosed() || audio == null || audio.length == 0) {
                return;
            }
            Instant now = clock.instant();
            session.touch(now);
            if (session.isPriming()) {
                log.fine(() -> "live.upstream.priming_audio_suppressed sessionId=" + session.id().value());
                return;
            }
            session.markFirstAudio(now).ifPresent(latency -> {
                metrics.recordFirstAudioLatency(latency);
                log.fine(() -> "live.upstream.first_audio sessionId=" + session.id().value() + " latencyMs=" + latency.toMillis());
            });
            session.sendAudio(audio);
        }

        @Override
        public void onText(String text) {
            if (session.isClosed() || text == null || text.isEmpty()) {
                return;
            }
            session.touch(clock.instant());
            if (session.isPriming()) {
                return;
            }
            session.appendResponseText(text);
        }

        @Override
        public void onToolCall(ToolCall call) {
            if (session.isClosed() || call == null) {
                return;
            }
            session.touch(clock.instant());
            if (!RESPONSE_TOOL.equals(call.name())) {
                log.warning("live.upstream.unknown_tool sessionId=" + session.id().value() + " name=" + call.name());
            }
            String reply = ToolResponseSanitizer.sanitize(call.args().get("response"));
            if (!session.isPriming()) {
                session.appendResponseText(reply);
            }
            try {
                session.channel().sendToolResponse(call.id(), call.name(), reply);
            } catch (RuntimeException e) {
                log.warning("live.upstream.tool_response_failed sessionId=" + session.id().value() + " message=" + e.getMessage());
            }
        }

        @Override
        public void onUsage(UsageCounters.UsageReport report) {
            session.usage().merge(report);
        }

        @Override
        public void onTurnComplete() {
            if (session.isClosed()) {
                return;
            }
            session.touch(clock.instant());
            if (session.isPriming()) {
                session.discardResponse();
                return;
            }
            turns.onTurnComplete(session);
        }

        @Override
        public void onInterrupted() {
            if (session.isClosed() || session.isPriming()) {
                return;
            }
            session.touch(clock.instant());
            turns.onInterrupted(session);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            log.info(() -> "live.upstream.closed sessionId=" + session.id().value() + " status=" + statusCode + " reason=" + reason);
            if (!session.isClosed()) {
                turns.onUpstreamClosed(session, reason);
            }
        }

        @Override
        public void onError(Throwable error) {
            log.warning("live.upstream.error sessionId=" + session.id().value() + " message=" + (error == null ? "" : error.getMessage()));
            if (!session.isClosed()) {
                turns.onUpstreamError(session, error);
            }
        }
    }
}
