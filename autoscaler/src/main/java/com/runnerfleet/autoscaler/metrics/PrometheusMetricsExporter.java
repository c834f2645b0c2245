package com.runnerfleet.autoscaler.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the autoscaler's meters in Prometheus text format.
 * <p>
 * Meters are recorded against reactor-netty's global registry, with a Prometheus
 * registry attached to it for scraping.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags("node_id", nodeId);
        log.info("Metrics exporter initialized with global registry + Prometheus");
    }

    /**
     * Uses a standalone Prometheus registry for both recording and scraping.
     */
    public PrometheusMetricsExporter(PrometheusMeterRegistry prometheusRegistry) {
        this.registry = prometheusRegistry;
        this.prometheusRegistry = prometheusRegistry;
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
