package me.go_gradually.voicelive.bootstrap;

import me.go_gradually.voicelive.application.shared.port.DelayScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UseCaseConfigTest {

    private final UseCaseConfig config = new UseCaseConfig();
    private final ScheduledExecutorService scheduler = config.liveScheduler();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void delayScheduler_runsTaskAfterDelay() throws Exception {
        DelayScheduler delayScheduler = config.delayScheduler(scheduler);
        CountDownLatch ran = new CountDownLatch(1);

        delayScheduler.schedule(ran::countDown, Duration.ofMillis(10));

        assertTrue(ran.await(2, TimeUnit.SECONDS));
    }

    @Test
    void delayScheduler_cancelPreventsTask() throws Exception {
        DelayScheduler delayScheduler = config.delayScheduler(scheduler);
        AtomicBoolean ran = new AtomicBoolean();

        DelayScheduler.Cancellable cancellable = delayScheduler.schedule(() -> ran.set(true), Duration.ofMillis(200));
        cancellable.cancel();
        Thread.sleep(400);

        assertFalse(ran.get());
    }
}
