package me.go_gradually.voicelive.application.live.model;

/**
 * Upstream events that need session-level handling beyond demultiplexing.
 */
public interface LiveTurnListener {
    void onTurnComplete(LiveSession session);

    void onInterrupted(LiveSession session);

    void onUpstreamClosed(LiveSession session, String reason);

    void onUpstreamError(LiveSession session, Throwable error);
}
