package com.cryptobot.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide Prometheus registry. The core components record into it; {@code /metrics} scrapes it.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;

    private MetricsService() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        logger.info("MetricsService initialized with Prometheus registry");
    }

    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String scrape() {
        return registry.scrape();
    }

    public void incrementRequests(String type) {
        registry.counter("bot.protocol.requests", "type", type).increment();
    }

    public void incrementRequestErrors(String type) {
        registry.counter("bot.protocol.errors", "type", type).increment();
    }
}
