package com.pnode.pnode_analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class StartupLogger implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);
    private final PNodeProperties properties;

    public StartupLogger(PNodeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("--- pNode Analytics Configuration Loaded ---");
        log.info("Online threshold: {} s", properties.getOnlineThresholdSeconds());

        PNodeProperties.GossipProperties gossip = properties.getGossip();
        if (gossip.getSeeds() != null && !gossip.getSeeds().isEmpty()) {
            log.info("Primary gossip seed: {}:{}", gossip.getSeeds().get(0), gossip.getRpcPort());
            log.info("Fallback gossip seeds: {}", gossip.getSeeds().subList(1, gossip.getSeeds().size()));
        } else {
            log.warn("No 'pnode.gossip.seeds' defined in configuration!");
        }
        log.info("Timeouts: primary {} ms, fallback {} ms, per-node stats {} ms",
                gossip.getPrimaryTimeout().toMillis(), gossip.getFallbackTimeout().toMillis(), gossip.getStatsTimeout().toMillis());

        PNodeProperties.RemoteProperties remote = properties.getCache().getRemote();
        log.info("Remote cache tier: {} (timeout {} ms, re-probe every {} s); local tier max entries: {}",
                remote.isEnabled() ? "enabled" : "disabled", remote.getTimeout().toMillis(),
                remote.getRetryInterval().toSeconds(), properties.getCache().getLocalMaxEntries());

        PNodeProperties.EnrichmentProperties enrichment = properties.getEnrichment();
        log.info("Stats enrichment: {} (period {} s, batch size {}, batch pause {} ms)",
                enrichment.isEnabled() ? "enabled" : "disabled", enrichment.getPeriod().toSeconds(),
                enrichment.getBatchSize(), enrichment.getBatchPause().toMillis());

        log.info("--- Configuration Load Complete ---");
    }
}
