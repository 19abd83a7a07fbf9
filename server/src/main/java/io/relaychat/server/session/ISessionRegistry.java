package io.relaychat.server.session;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the connection registry (Dependency Inversion Principle).
 * <p>
 * Maps each registered handle to its live {@link Session}; at most one session per handle.
 * </p>
 */
public interface ISessionRegistry {
    /**
     * Makes the session reachable under its handle.
     *
     * @param session session to register
     * @throws HandleTakenException if another session holds the handle; nothing is changed
     */
    void register(Session session) throws HandleTakenException;

    /**
     * Removes the session registered under {@code handle}, if any.
     *
     * @param handle handle to release
     */
    void unregister(String handle);

    /**
     * Finds the live session for a handle.
     *
     * @param handle handle to look up
     * @return the session, or empty if the handle is not registered
     */
    Optional<Session> lookup(String handle);

    /**
     * Sorted snapshot of registered handles; unaffected by later changes.
     *
     * @return immutable list of handles
     */
    List<String> listHandles();

    int size();

    /**
     * Closes every live session (graceful shutdown). Handlers unregister as their connections end.
     */
    void drainAll();
}
