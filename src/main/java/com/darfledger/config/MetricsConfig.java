package com.darfledger.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry for the ledger. An embedding application that already exposes a
 * registry (e.g. through actuator) replaces this in-memory one. The ledger metrics themselves
 * live in {@link com.darfledger.observability.LedgerMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry(@Value("${spring.application.name:darf-ledger}") String applicationName) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", applicationName);
        return registry;
    }
}
