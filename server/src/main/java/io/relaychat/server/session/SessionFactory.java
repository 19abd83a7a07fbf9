package io.relaychat.server.session;

import io.relaychat.core.protocol.ServerMessage;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.metrics.MetricsService;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Creates sessions with a bounded outbound queue.
 */
public class SessionFactory {
    private final ServerConfig config;
    private final MetricsService metricsService;

    public SessionFactory(ServerConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;
    }

    /**
     * Creates a new session instance.
     *
     * @param handle        handle requested by the client
     * @param remoteAddress peer address, for logging
     * @return Session instance, not yet registered
     */
    public Session createSession(String handle, String remoteAddress) {
        // Single subscriber (the writer); the queue bound is the per-connection backlog
        Sinks.Many<ServerMessage> sink = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<ServerMessage>get(config.getPerConnBufferSize()).get()
        );

        return new Session(handle, remoteAddress, sink, metricsService);
    }
}
