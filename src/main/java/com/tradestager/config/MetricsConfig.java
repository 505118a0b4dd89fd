package com.tradestager.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name and the ledger backend in use, so staging
 * metrics from an in-memory instance are never mixed with those of a Redis-backed one. The
 * staging meters themselves are defined in
 * {@link com.tradestager.observability.StagingMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final String ledgerBackend;

    public MetricsConfig(
            MeterRegistry meterRegistry, @Value("${" + RedisConfig.LEDGER_BACKEND_PROPERTY + ":memory}") String ledgerBackend) {
        this.meterRegistry = meterRegistry;
        this.ledgerBackend = ledgerBackend;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "tradestager", "ledger", ledgerBackend);
    }
}
