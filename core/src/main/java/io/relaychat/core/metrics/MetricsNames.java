package io.relaychat.core.metrics;

/**
 * Micrometer metric names used by the relay server.
 * <p>
 * <b>Naming convention:</b> {@code relay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Distribution summaries: {@code .size} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: TCP connections accepted.
     */
    public static final String CONNECTIONS_TOTAL = "relay.server.connections.total";

    /**
     * Counter: Registration attempts.
     * <p>
     * Tags: result (accepted/rejected)
     * </p>
     */
    public static final String REGISTRATIONS_TOTAL = "relay.server.registrations.total";

    /**
     * Gauge: Currently registered sessions.
     */
    public static final String ACTIVE_SESSIONS = "relay.server.sessions.active";

    /**
     * Gauge: Chat logs held in memory.
     */
    public static final String CHAT_LOGS = "relay.server.chat.logs";

    /**
     * Counter: Chat messages appended and forwarded to a live target.
     */
    public static final String RELAYED_TOTAL = "relay.server.relayed.total";

    /**
     * Counter: Requests rejected with an error reply.
     * <p>
     * Tags: reason (unknown_target/self_chat/already_registered/malformed)
     * </p>
     */
    public static final String REJECTED_TOTAL = "relay.server.rejected.total";

    /**
     * Counter: Outbound frames dropped before reaching the socket.
     * <p>
     * Tags: reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "relay.server.drops.total";

    /**
     * Counter: Connections closed for a protocol violation.
     */
    public static final String PROTOCOL_VIOLATIONS_TOTAL = "relay.server.protocol.violations.total";

    /**
     * Counter: Bytes read from clients, frame headers included.
     */
    public static final String NETWORK_INBOUND_BYTES = "relay.server.network.inbound.bytes";

    /**
     * Counter: Bytes written to clients, frame headers included.
     */
    public static final String NETWORK_OUTBOUND_BYTES = "relay.server.network.outbound.bytes";

    /**
     * Distribution Summary: Inbound frame size distribution (bytes).
     */
    public static final String FRAME_SIZE_INBOUND = "relay.server.frame.size.inbound";

    /**
     * Distribution Summary: Outbound frame size distribution (bytes).
     */
    public static final String FRAME_SIZE_OUTBOUND = "relay.server.frame.size.outbound";
}
