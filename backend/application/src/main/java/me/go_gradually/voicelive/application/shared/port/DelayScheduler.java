package me.go_gradually.voicelive.application.shared.port;

import java.time.Duration;

@FunctionalInterface
public interface DelayScheduler {
    Cancellable schedule(Runnable task, Duration delay);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
