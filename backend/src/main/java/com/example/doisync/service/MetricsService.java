package com.example.doisync.service;

import com.example.doisync.sync.SyncOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
public class MetricsService {
    private final Logger log = LoggerFactory.getLogger(MetricsService.class);

    static final String OUTCOMES = "doisync.outcomes";
    static final String RETRIES = "doisync.remote.retries";
    static final String UPGRADES = "doisync.schema.upgrades";

    private final MeterRegistry meterRegistry;

    public MetricsService(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public void recordOutcome(SyncOutcome outcome) {
        increment(OUTCOMES, "facet", outcome.facet().name(), "status", outcome.status().name());
        if (outcome.retried()) increment(RETRIES);
        if (outcome.schemaUpgraded()) increment(UPGRADES);
    }

    public void increment(String metric, String... tags) {
        if (meterRegistry == null) {
            log.debug("metric increment: {} {}", metric, String.join(",", tags));
            return;
        }
        Counter.builder(metric).tags(tags).register(meterRegistry).increment();
    }
}
