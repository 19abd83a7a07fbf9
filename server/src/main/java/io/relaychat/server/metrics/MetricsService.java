package io.relaychat.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.relaychat.core.metrics.MetricsNames;
import io.relaychat.core.metrics.MetricsTags;
import io.relaychat.server.chat.IChatStore;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.session.ISessionRegistry;

/**
 * Centralized metrics service for the relay server.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String serverId;

    // Counters
    private final Counter connections;
    private final Counter registrationsAccepted;
    private final Counter registrationsRejected;
    private final Counter relayed;
    private final Counter rejectedUnknownTarget;
    private final Counter rejectedSelfChat;
    private final Counter rejectedAlreadyRegistered;
    private final Counter rejectedMalformed;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;
    private final Counter protocolViolations;

    // Network traffic counters (bytes)
    private final Counter networkInbound;
    private final Counter networkOutbound;

    private final DistributionSummary frameSizeInbound;
    private final DistributionSummary frameSizeOutbound;

    public MetricsService(MeterRegistry registry, ServerConfig config) {
        this.registry = registry;
        this.serverId = config.getServerId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connections = Counter.builder(MetricsNames.CONNECTIONS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("TCP connections accepted")
            .register(registry);

        registrationsAccepted = Counter.builder(MetricsNames.REGISTRATIONS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .tag(MetricsTags.RESULT, "accepted")
            .register(registry);

        registrationsRejected = Counter.builder(MetricsNames.REGISTRATIONS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .tag(MetricsTags.RESULT, "rejected")
            .register(registry);

        relayed = Counter.builder(MetricsNames.RELAYED_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("Chat messages appended and handed to the target session")
            .register(registry);

        rejectedUnknownTarget = rejectedCounter("unknown_target");
        rejectedSelfChat = rejectedCounter("self_chat");
        rejectedAlreadyRegistered = rejectedCounter("already_registered");
        rejectedMalformed = rejectedCounter("malformed");

        dropsBufferFull = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Outbound frames dropped due to a full session buffer")
            .register(registry);

        dropsClosed = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .tag(MetricsTags.REASON, "closed")
            .description("Outbound frames dropped because the session was closing")
            .register(registry);

        protocolViolations = Counter.builder(MetricsNames.PROTOCOL_VIOLATIONS_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .register(registry);

        networkInbound = Counter.builder(MetricsNames.NETWORK_INBOUND_BYTES)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("Total bytes received from clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutbound = Counter.builder(MetricsNames.NETWORK_OUTBOUND_BYTES)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("Total bytes sent to clients")
            .baseUnit("bytes")
            .register(registry);

        frameSizeInbound = DistributionSummary.builder(MetricsNames.FRAME_SIZE_INBOUND)
            .tag(MetricsTags.SERVER_ID, serverId)
            .baseUnit("bytes")
            .register(registry);

        frameSizeOutbound = DistributionSummary.builder(MetricsNames.FRAME_SIZE_OUTBOUND)
            .tag(MetricsTags.SERVER_ID, serverId)
            .baseUnit("bytes")
            .register(registry);
    }

    private Counter rejectedCounter(String reason) {
        return Counter.builder(MetricsNames.REJECTED_TOTAL)
            .tag(MetricsTags.SERVER_ID, serverId)
            .tag(MetricsTags.REASON, reason)
            .register(registry);
    }

    /**
     * Exposes the size of the shared registry and store as gauges.
     */
    public void bindStateGauges(ISessionRegistry sessionRegistry, IChatStore chatStore) {
        Gauge.builder(MetricsNames.ACTIVE_SESSIONS, sessionRegistry, ISessionRegistry::size)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("Registered sessions")
            .register(registry);

        Gauge.builder(MetricsNames.CHAT_LOGS, chatStore, IChatStore::size)
            .tag(MetricsTags.SERVER_ID, serverId)
            .description("Chat logs held in memory")
            .register(registry);
    }

    public void recordConnection() {
        connections.increment();
    }

    public void recordRegistration(boolean accepted) {
        (accepted ? registrationsAccepted : registrationsRejected).increment();
    }

    public void recordRelayed() {
        relayed.increment();
    }

    public void recordUnknownTarget() {
        rejectedUnknownTarget.increment();
    }

    public void recordSelfChat() {
        rejectedSelfChat.increment();
    }

    public void recordAlreadyRegistered() {
        rejectedAlreadyRegistered.increment();
    }

    public void recordMalformed() {
        rejectedMalformed.increment();
    }

    public void recordDropBufferFull() {
        dropsBufferFull.increment();
    }

    public void recordDropClosed() {
        dropsClosed.increment();
    }

    public void recordProtocolViolation() {
        protocolViolations.increment();
    }

    /**
     * Records one frame received from a client.
     *
     * @param bytes frame size, header included
     */
    public void recordInbound(long bytes) {
        networkInbound.increment(bytes);
        frameSizeInbound.record(bytes);
    }

    /**
     * Records one frame written to a client.
     *
     * @param bytes frame size, header included
     */
    public void recordOutbound(long bytes) {
        networkOutbound.increment(bytes);
        frameSizeOutbound.record(bytes);
    }
}
