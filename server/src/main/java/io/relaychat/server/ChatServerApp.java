package io.relaychat.server;

import io.relaychat.server.chat.ChatStore;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.http.AdminHttpServer;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.metrics.PrometheusMetricsExporter;
import io.relaychat.server.net.ChatServer;
import io.relaychat.server.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;

/**
 * Main entry point for the relay server.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Accept TCP clients speaking the length-prefixed protocol</li>
 *   <li>Keep the handle registry and pairwise chat logs in memory</li>
 *   <li>Relay chat messages to connected targets</li>
 *   <li>Expose /healthz, /readyz and /metrics on the admin port</li>
 * </ul>
 * </p>
 * <p>
 * Usage: {@code ChatServerApp [host:port]}; the argument overrides {@code BIND_HOST}/{@code PORT}.
 * </p>
 */
public class ChatServerApp {
    private static final Logger log = LoggerFactory.getLogger(ChatServerApp.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromEnv();
        if (args.length > 0) {
            config = config.withListenAddress(args[0]);
        }
        MDC.put("serverId", config.getServerId());

        log.info("Starting relay server: {}", config.getServerId());
        log.info("  Listen: {}:{}", config.getBindHost(), config.getPort());
        log.info("  Admin port: {}", config.getAdminPort() > 0 ? config.getAdminPort() : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getServerId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);
        SessionRegistry sessionRegistry = new SessionRegistry();
        ChatStore chatStore = new ChatStore();
        metricsService.bindStateGauges(sessionRegistry, chatStore);

        ChatServer chatServer = new ChatServer(config, sessionRegistry, chatStore, metricsService);
        try {
            chatServer.start();
        } catch (IOException e) {
            log.error("Cannot bind {}:{}", config.getBindHost(), config.getPort(), e);
            System.exit(1);
            return;
        }

        AdminHttpServer adminServer = null;
        if (config.getAdminPort() > 0) {
            adminServer = new AdminHttpServer(config, chatServer, metricsExporter);
            adminServer.start();
        }

        log.info("Relay server {} is ready", config.getServerId());

        handleShutdown(config, chatServer, adminServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(ServerConfig config, ChatServer chatServer, AdminHttpServer adminServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("serverId", config.getServerId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            chatServer.stop();

            if (adminServer != null) {
                adminServer.stop();
            }

            log.info("Shutdown complete");
        }));
    }
}
