package io.relaychat.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus metrics exporter backing the admin {@code /metrics} endpoint.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String serverId) {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags("instance_id", serverId);
        log.info("Metrics exporter initialized with Prometheus registry");
    }

    public MeterRegistry getRegistry() {
        return prometheusRegistry;
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
