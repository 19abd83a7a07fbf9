package io.relaychat.server.http;

import io.relaychat.core.metrics.MetricsNames;
import io.relaychat.server.chat.ChatStore;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.metrics.PrometheusMetricsExporter;
import io.relaychat.server.net.ChatServer;
import io.relaychat.server.session.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.test.StepVerifier;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdminHttpServerTest {

    private ChatServer chatServer;
    private AdminHttpServer adminServer;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        ServerConfig config = ServerConfig.builder()
                .serverId("admin-test")
                .bindHost("127.0.0.1")
                .port(0)
                .adminPort(0)
                .maxFrameBytes(1024)
                .perConnBufferSize(16)
                .shutdownGrace(Duration.ofSeconds(1))
                .build();
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(config.getServerId());
        MetricsService metricsService = new MetricsService(exporter.getRegistry(), config);
        SessionRegistry sessionRegistry = new SessionRegistry();
        ChatStore chatStore = new ChatStore();
        metricsService.bindStateGauges(sessionRegistry, chatStore);

        chatServer = new ChatServer(config, sessionRegistry, chatStore, metricsService);
        chatServer.start();
        adminServer = new AdminHttpServer(config, chatServer, exporter);
        DisposableServer bound = adminServer.start();
        httpClient = HttpClient.create().host("127.0.0.1").port(bound.port());
    }

    @AfterEach
    void tearDown() {
        adminServer.stop();
        chatServer.stop();
    }

    private Mono<Tuple2<Integer, String>> get(String path) {
        return httpClient.get()
                .uri(path)
                .responseSingle((res, body) -> body.asString()
                        .defaultIfEmpty("")
                        .map(text -> Tuples.of(res.status().code(), text)));
    }

    @Test
    void healthAndReadinessWhileServing() {
        StepVerifier.create(get("/healthz"))
                .expectNext(Tuples.of(200, "OK"))
                .verifyComplete();
        StepVerifier.create(get("/readyz"))
                .expectNext(Tuples.of(200, "Ready"))
                .verifyComplete();
    }

    @Test
    void unhealthyOnceDraining() {
        chatServer.stop();

        StepVerifier.create(get("/healthz"))
                .expectNext(Tuples.of(503, "Draining"))
                .verifyComplete();
        StepVerifier.create(get("/readyz"))
                .expectNext(Tuples.of(503, "Not Ready - Draining"))
                .verifyComplete();
    }

    @Test
    void metricsExposeRelayMeters() {
        StepVerifier.create(get("/metrics"))
                .assertNext(response -> {
                    assertEquals(200, response.getT1());
                    String prometheusName = MetricsNames.ACTIVE_SESSIONS.replace('.', '_');
                    assertTrue(response.getT2().contains(prometheusName), response.getT2());
                    assertTrue(response.getT2().contains("instance_id=\"admin-test\""));
                })
                .verifyComplete();
    }
}
