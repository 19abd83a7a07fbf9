package io.relaychat.server.net;

import io.relaychat.core.codec.FrameCodec;
import io.relaychat.server.chat.IChatStore;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.router.MessageRouter;
import io.relaychat.server.session.ISessionRegistry;
import io.relaychat.server.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP front end: accepts connections and runs a {@link ConnectionHandler} per connection.
 * <p>
 * The accept loop runs on a single thread and never performs per-connection I/O.
 * </p>
 */
public class ChatServer {
    private static final Logger log = LoggerFactory.getLogger(ChatServer.class);

    private final ServerConfig config;
    private final ISessionRegistry sessionRegistry;
    private final MetricsService metricsService;
    private final FrameCodec codec;
    private final SessionFactory sessionFactory;
    private final MessageRouter router;

    private final Set<ConnectionHandler> handlers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final ExecutorService connectionPool;

    private volatile ServerSocket serverSocket;

    public ChatServer(ServerConfig config, ISessionRegistry sessionRegistry, IChatStore chatStore,
                      MetricsService metricsService) {
        this.config = config;
        this.sessionRegistry = sessionRegistry;
        this.metricsService = metricsService;
        this.codec = new FrameCodec(config.getMaxFrameBytes());
        this.sessionFactory = new SessionFactory(config, metricsService);
        this.router = new MessageRouter(sessionRegistry, chatStore, metricsService);
        this.connectionPool = Executors.newCachedThreadPool(namedThreadFactory("relay-conn-"));
    }

    /**
     * Binds the listening socket and starts accepting.
     *
     * @return the bound port
     * @throws IOException if the address cannot be bound
     */
    public synchronized int start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(config.getBindHost(), config.getPort()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;

        new Thread(this::acceptLoop, "relay-acceptor").start();

        log.info("Chat server {} listening on {}", config.getServerId(), serverSocket.getLocalSocketAddress());
        return serverSocket.getLocalPort();
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public boolean isDraining() {
        return draining.get();
    }

    /**
     * Stops accepting, drains sessions and waits up to the configured grace period for
     * connections to finish before closing the rest.
     */
    public void stop() {
        if (!draining.compareAndSet(false, true)) {
            log.warn("Stop already in progress");
            return;
        }
        log.info("Stopping chat server {}", config.getServerId());

        closeServerSocket();
        sessionRegistry.drainAll();
        handlers.stream()
            .filter(handler -> handler.getState() == ConnectionState.AWAITING_REGISTRATION)
            .forEach(ConnectionHandler::close);

        connectionPool.shutdown();
        try {
            long graceMillis = config.getShutdownGrace().toMillis();
            if (!connectionPool.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("{} connections still open after {} ms, closing them", handlers.size(), graceMillis);
                handlers.forEach(ConnectionHandler::close);
                connectionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlers.forEach(ConnectionHandler::close);
            connectionPool.shutdownNow();
        }

        log.info("Chat server stopped");
    }

    private void acceptLoop() {
        AtomicInteger accepted = new AtomicInteger();
        while (!serverSocket.isClosed()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (serverSocket.isClosed()) {
                    break;
                }
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }

            if (draining.get()) {
                closeQuietly(socket);
                continue;
            }

            metricsService.recordConnection();
            log.debug("Accepted connection #{} from {}", accepted.incrementAndGet(), socket.getRemoteSocketAddress());
            try {
                socket.setTcpNoDelay(true);
                dispatch(socket);
            } catch (IOException | RejectedExecutionException e) {
                log.warn("Dropping connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
        log.debug("Accept loop finished");
    }

    private void dispatch(Socket socket) {
        ConnectionHandler handler = new ConnectionHandler(
            socket, config.getServerId(), codec, sessionFactory, sessionRegistry, router, metricsService,
            config.getShutdownGrace()
        );
        handlers.add(handler);
        try {
            connectionPool.execute(() -> {
                try {
                    handler.run();
                } finally {
                    handlers.remove(handler);
                }
            });
        } catch (RejectedExecutionException e) {
            handlers.remove(handler);
            throw e;
        }
    }

    private void closeServerSocket() {
        if (serverSocket == null) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing listening socket: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
