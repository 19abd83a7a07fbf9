package io.relaychat.server.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks registered sessions.
 * <p>
 * Check-then-insert is a single {@link ConcurrentHashMap#putIfAbsent}, so two connections
 * racing for the same handle cannot both win.
 * </p>
 */
public class SessionRegistry implements ISessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    // Active sessions: handle -> Session
    private final Map<String, Session> activeSessions = new ConcurrentHashMap<>();

    @Override
    public void register(Session session) throws HandleTakenException {
        Session existing = activeSessions.putIfAbsent(session.getHandle(), session);
        if (existing != null) {
            throw new HandleTakenException(session.getHandle());
        }
        log.debug("Session registered for handle {} from {}", session.getHandle(), session.getRemoteAddress());
    }

    @Override
    public void unregister(String handle) {
        Session session = activeSessions.remove(handle);
        if (session != null) {
            log.debug("Session removed for handle {}", handle);
        }
    }

    @Override
    public Optional<Session> lookup(String handle) {
        return Optional.ofNullable(activeSessions.get(handle));
    }

    @Override
    public List<String> listHandles() {
        return activeSessions.keySet().stream().sorted().toList();
    }

    @Override
    public int size() {
        return activeSessions.size();
    }

    @Override
    public void drainAll() {
        log.info("Draining {} active sessions", activeSessions.size());
        activeSessions.values().forEach(Session::close);
    }
}
