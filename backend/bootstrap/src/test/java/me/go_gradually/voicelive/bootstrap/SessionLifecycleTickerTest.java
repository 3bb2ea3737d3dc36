package me.go_gradually.voicelive.bootstrap;

import me.go_gradually.voicelive.application.session.usecase.SessionLifecycleSupervisor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleTickerTest {

    @Mock
    private SessionLifecycleSupervisor supervisor;
    @Mock
    private ScheduledExecutorService scheduler;
    @Mock
    private ScheduledFuture<?> future;

    @Test
    void start_schedulesTickAtCheckInterval() {
        when(supervisor.checkInterval()).thenReturn(Duration.ofSeconds(15));
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(15_000L), eq(15_000L), eq(TimeUnit.MILLISECONDS));
        SessionLifecycleTicker ticker = new SessionLifecycleTicker(supervisor, scheduler);

        ticker.start();
        ticker.stop();

        verify(future).cancel(false);
    }

    @Test
    void tick_keepsRunningWhenSupervisorFails() {
        doThrow(new IllegalStateException("boom")).when(supervisor).tick();
        SessionLifecycleTicker ticker = new SessionLifecycleTicker(supervisor, scheduler);

        assertDoesNotThrow(ticker::tick);
        verify(supervisor).tick();
    }
}
