package io.relaychat.server.http;

import io.netty.channel.ChannelOption;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.metrics.PrometheusMetricsExporter;
import io.relaychat.server.net.ChatServer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;

/**
 * HTTP server for health checks and metrics, separate from the chat port.
 */
@RequiredArgsConstructor
public class AdminHttpServer {
    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final ServerConfig config;
    private final ChatServer chatServer;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = HttpServer.create()
            .host(config.getBindHost())
            .port(config.getAdminPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .route(routes -> routes
                // Liveness; fails while draining so the instance is taken out of rotation
                .get("/healthz", (req, res) -> {
                    if (chatServer.isDraining()) {
                        return res.status(503).sendString(Mono.just("Draining"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (chatServer.isDraining()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Draining"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.fromSupplier(metricsExporter::scrape))
                )
            )
            .bind()
            .doOnNext(bound -> log.info("Admin HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start admin HTTP server", err))
            .block(Duration.ofSeconds(30));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(10));
        }
    }
}
