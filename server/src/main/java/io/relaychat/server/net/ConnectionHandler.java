package io.relaychat.server.net;

import io.relaychat.core.codec.DecodeException;
import io.relaychat.core.codec.FrameCodec;
import io.relaychat.core.protocol.ClientMessage;
import io.relaychat.core.protocol.ClientMessages;
import io.relaychat.core.protocol.ServerMessages;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.router.MessageRouter;
import io.relaychat.server.session.ISessionRegistry;
import io.relaychat.server.session.Session;
import io.relaychat.server.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one accepted connection on its own thread.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>Register: must be the first frame; anything else closes the connection without a reply</li>
 *   <li>ListUsers, GetMessages, SendMessage: any order, any number of times once registered</li>
 * </ul>
 * </p>
 * <p>
 * A payload that fails to decode while registered is answered with {@code Error} and the loop
 * continues; transport and framing errors end the connection. However the connection ends,
 * the handle is released and replies already queued are written before the socket closes.
 * </p>
 */
public class ConnectionHandler implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Socket socket;
    private final String serverId;
    private final FrameCodec codec;
    private final SessionFactory sessionFactory;
    private final ISessionRegistry sessionRegistry;
    private final MessageRouter router;
    private final MetricsService metricsService;
    private final Duration drainTimeout;
    private final String remoteAddress;

    private volatile ConnectionState state = ConnectionState.AWAITING_REGISTRATION;
    private Session session;

    public ConnectionHandler(
            Socket socket,
            String serverId,
            FrameCodec codec,
            SessionFactory sessionFactory,
            ISessionRegistry sessionRegistry,
            MessageRouter router,
            MetricsService metricsService,
            Duration drainTimeout
    ) {
        this.socket = socket;
        this.serverId = serverId;
        this.codec = codec;
        this.sessionFactory = sessionFactory;
        this.sessionRegistry = sessionRegistry;
        this.router = router;
        this.metricsService = metricsService;
        this.drainTimeout = drainTimeout;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void run() {
        MDC.put("serverId", serverId);
        MDC.put("remote", remoteAddress);
        try {
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());

            session = awaitRegistration(in, out);
            if (session != null) {
                state = ConnectionState.ACTIVE;
                MDC.put("handle", session.getHandle());
                serve(in);
            }
        } catch (IOException e) {
            log.info("Connection {} ended: {}", remoteAddress, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error on connection {}", remoteAddress, e);
        } finally {
            cleanup();
            MDC.clear();
        }
    }

    /**
     * Closes the socket, unblocking the read loop.
     */
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket {}: {}", remoteAddress, e.getMessage());
        }
    }

    private Session awaitRegistration(InputStream in, OutputStream out) throws IOException {
        Optional<byte[]> frame = codec.readFrame(in);
        if (frame.isEmpty()) {
            log.debug("Connection {} closed before registering", remoteAddress);
            return null;
        }
        metricsService.recordInbound(FrameCodec.HEADER_SIZE + frame.get().length);

        ClientMessage request;
        try {
            request = codec.decodeClientMessage(frame.get());
        } catch (DecodeException e) {
            protocolViolation("undecodable first frame: " + e.getMessage());
            return null;
        }
        if (!(request instanceof ClientMessages.Register register)) {
            protocolViolation("expected Register but got " + request.getClass().getSimpleName());
            return null;
        }

        Session candidate = sessionFactory.createSession(register.getHandle(), remoteAddress);
        Optional<ServerMessages.Error> rejection = router.register(candidate);
        if (rejection.isPresent()) {
            candidate.close();
            // No writer was started, so this thread still owns the output stream
            metricsService.recordOutbound(codec.writeFrame(out, rejection.get()));
            return null;
        }

        candidate.startWriter(codec, out, socket);
        return candidate;
    }

    private void serve(InputStream in) throws IOException {
        while (true) {
            Optional<byte[]> frame = codec.readFrame(in);
            if (frame.isEmpty()) {
                log.info("{} disconnected", session.getHandle());
                return;
            }
            metricsService.recordInbound(FrameCodec.HEADER_SIZE + frame.get().length);

            ClientMessage request;
            try {
                request = codec.decodeClientMessage(frame.get());
            } catch (DecodeException e) {
                log.warn("Malformed request from {}: {}", session.getHandle(), e.getMessage());
                metricsService.recordMalformed();
                session.send(new ServerMessages.Error("Malformed request: " + e.getMessage()));
                continue;
            }

            log.debug("Processing {} from {}", request, session.getHandle());
            router.route(session, request);
        }
    }

    private void protocolViolation(String reason) {
        log.warn("Protocol violation from {}: {}", remoteAddress, reason);
        metricsService.recordProtocolViolation();
    }

    private void cleanup() {
        state = ConnectionState.CLOSED;
        if (session != null) {
            sessionRegistry.unregister(session.getHandle());
            session.close();
            // The writer closes the socket once queued replies are flushed
            awaitWriter();
        }
        close();
    }

    private void awaitWriter() {
        try {
            if (!session.awaitWriter(drainTimeout)) {
                log.warn("Outbound queue for {} not drained within {} ms, closing", session.getHandle(), drainTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
