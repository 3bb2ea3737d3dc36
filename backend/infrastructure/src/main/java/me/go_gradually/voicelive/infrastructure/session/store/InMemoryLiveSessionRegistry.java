package me.go_gradually.voicelive.infrastructure.session.store;

import me.go_gradually.voicelive.application.live.model.LiveSession;
import me.go_gradually.voicelive.application.session.port.LiveSessionRegistry;
import me.go_gradually.voicelive.application.shared.error.SessionIdReusedException;
import me.go_gradually.voicelive.domain.session.SessionId;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryLiveSessionRegistry implements LiveSessionRegistry {
    private final Map<SessionId, LiveSession> sessions = new ConcurrentHashMap<>();
    // 닫힌 세션의 id도 남겨 두어 재사용을 막는다.
    private final Set<SessionId> issuedIds = ConcurrentHashMap.newKeySet();

    @Override
    public void register(LiveSession session) {
        if (!issuedIds.add(session.id())) {
            throw new SessionIdReusedException(session.id().value());
        }
        sessions.put(session.id(), session);
    }

    @Override
    public Optional<LiveSession> find(SessionId sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void remove(SessionId sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public Collection<LiveSession> all() {
        return List.copyOf(sessions.values());
    }
}
