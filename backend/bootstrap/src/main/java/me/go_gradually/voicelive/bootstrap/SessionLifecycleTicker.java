package me.go_gradually.voicelive.bootstrap;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import me.go_gradually.voicelive.application.session.usecase.SessionLifecycleSupervisor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs the lifecycle check over all live sessions at the configured interval.
 */
@Component
public class SessionLifecycleTicker {
    private static final Logger log = Logger.getLogger(SessionLifecycleTicker.class.getName());

    private final SessionLifecycleSupervisor supervisor;
    private final ScheduledExecutorService liveScheduler;
    private ScheduledFuture<?> tickTask;

    public SessionLifecycleTicker(SessionLifecycleSupervisor supervisor,
                                  @Qualifier("liveScheduler") ScheduledExecutorService liveScheduler) {
        this.supervisor = supervisor;
        this.liveScheduler = liveScheduler;
    }

    @PostConstruct
    public void start() {
        Duration interval = supervisor.checkInterval();
        tickTask = liveScheduler.scheduleAtFixedRate(this::tick, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info(() -> "lifecycle.ticker.started intervalMs=" + interval.toMillis());
    }

    @PreDestroy
    public void stop() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
    }

    void tick() {
        // 예외가 새어 나가면 scheduleAtFixedRate가 이후 실행을 멈춘다.
        try {
            supervisor.tick();
        } catch (RuntimeException e) {
            log.warning("lifecycle.tick_failed message=" + e.getMessage());
        }
    }
}
