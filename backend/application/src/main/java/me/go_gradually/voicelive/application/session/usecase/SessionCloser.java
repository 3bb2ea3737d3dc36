package me.go_gradually.voicelive.application.session.usecase;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.domain.session.SessionStopReason;

@FunctionalInterface
public interface SessionCloser {
    void close(LiveSession session, SessionStopReason reason);
}
