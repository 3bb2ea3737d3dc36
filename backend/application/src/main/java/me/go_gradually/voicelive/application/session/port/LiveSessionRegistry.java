package me.go_gradually.voicelive.application.session.port;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.domain.session.SessionId;

import java.util.Collection;
import java.util.Optional;

public interface LiveSessionRegistry {
    /**
     * Registers a new session. Ids are never handed out twice, even after removal.
     *
     * @throws me.go_gradually.voicelive.application.shared.error.SessionIdReusedException if the id was seen before
     */
    void register(LiveSession session);

    Optional<LiveSession> find(SessionId sessionId);

    void remove(SessionId sessionId);

    Collection<LiveSession> all();
}
