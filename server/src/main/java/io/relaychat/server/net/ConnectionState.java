package io.relaychat.server.net;

/**
 * Lifecycle of one client connection.
 */
public enum ConnectionState {
    /**
     * Accepted; the first frame must be {@code Register}.
     */
    AWAITING_REGISTRATION,
    /**
     * Registered; requests are routed until the peer disconnects.
     */
    ACTIVE,
    /**
     * Socket closed and handle released.
     */
    CLOSED
}
