package com.pnode.pnode_analytics.config;

import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.service.StatsEnrichmentScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Probes the remote cache tier without blocking startup, then starts stats enrichment
 * whatever the probe outcome.
 */
@Component
@Order(2)
public class BackgroundJobsInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobsInitializer.class);

    private final TieredCache tieredCache;
    private final StatsEnrichmentScheduler enrichmentScheduler;
    private final boolean enrichmentEnabled;

    public BackgroundJobsInitializer(TieredCache tieredCache,
                                     StatsEnrichmentScheduler enrichmentScheduler,
                                     PNodeProperties properties) {
        this.tieredCache = tieredCache;
        this.enrichmentScheduler = enrichmentScheduler;
        this.enrichmentEnabled = properties.getEnrichment().isEnabled();
    }

    @Override
    public void run(String... args) {
        tieredCache.initialize()
                .subscribe(remoteUp -> {
                    if (enrichmentEnabled) {
                        enrichmentScheduler.start();
                    } else {
                        log.info("Stats enrichment disabled (pnode.enrichment.enabled=false)");
                    }
                });
    }
}
