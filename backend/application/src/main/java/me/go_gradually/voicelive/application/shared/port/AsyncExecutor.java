package me.go_gradually.voicelive.application.shared.port;

@FunctionalInterface
public interface AsyncExecutor {
    void execute(Runnable task);
}
