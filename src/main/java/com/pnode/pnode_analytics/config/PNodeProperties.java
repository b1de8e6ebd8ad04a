package com.pnode.pnode_analytics.config;


import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "pnode")
public class PNodeProperties {

    // A node is online iff it was seen less than this many seconds ago
    private long onlineThresholdSeconds = 300;

    private GossipProperties gossip = new GossipProperties();
    private CacheProperties cache = new CacheProperties();
    private EnrichmentProperties enrichment = new EnrichmentProperties();
    private GeoProperties geo = new GeoProperties();

    @Data
    public static class GossipProperties {
        // Seed IPs for pRPC discovery; the first one is the primary, the rest are fallbacks in order
        private List<String> seeds = new ArrayList<>();
        private int rpcPort = 6000;
        private Duration primaryTimeout = Duration.ofSeconds(10);
        private Duration fallbackTimeout = Duration.ofSeconds(5);
        private Duration statsTimeout = Duration.ofSeconds(8);
    }

    @Data
    public static class CacheProperties {
        private int localMaxEntries = 10000;
        private RemoteProperties remote = new RemoteProperties();
    }

    @Data
    public static class RemoteProperties {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(1);
        // Minimum time between re-probes while the remote tier is down
        private Duration retryInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class EnrichmentProperties {
        private boolean enabled = true;
        private Duration period = Duration.ofSeconds(90);
        private Duration initialDelay = Duration.ofSeconds(5);
        private int batchSize = 15;
        private Duration batchPause = Duration.ofMillis(100);
    }

    @Data
    public static class GeoProperties {
        private String baseUrl = "http://ip-api.com";
        private Duration timeout = Duration.ofSeconds(2);
        private int concurrency = 20;
    }

}
