package com.fnmesh.router.metrics;

import com.fnmesh.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Publishes the router's meters, and Reactor Netty's, in Prometheus text format.
 * <p>
 * Router components register on {@link #getRegistry()}, the global composite that Reactor Netty
 * also reports to; a Prometheus registry is attached to it for {@link #scrape()}.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this(Metrics.REGISTRY, nodeId);
    }

    public PrometheusMetricsExporter(MeterRegistry registry, String nodeId) {
        this.registry = registry;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Registry {} is not a composite, only its own meters are scraped", registry.getClass().getSimpleName());
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
