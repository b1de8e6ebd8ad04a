package com.pnode.pnode_analytics.support;

import com.pnode.pnode_analytics.config.JacksonConfig;
import com.pnode.pnode_analytics.config.PNodeProperties;
import com.pnode.pnode_analytics.core.cache.LocalCacheTier;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.network.discovery.DiscoveryStrategy;
import com.pnode.pnode_analytics.network.discovery.NodeDiscoveryService;
import com.pnode.pnode_analytics.network.discovery.NodeStatusResolver;
import com.pnode.pnode_analytics.network.discovery.PodNormalizer;
import com.pnode.pnode_analytics.network.model.RawPod;
import com.pnode.pnode_analytics.service.NodeStatsService;
import com.pnode.pnode_analytics.service.PNodeService;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Wires the node services against in-memory fakes: one gossip seed, a fake remote cache
 * tier and a clock that only moves on request.
 */
public class ServiceFixture {

    public static final String SEED = "seed";

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final PNodeProperties properties = new PNodeProperties();
    public final FakeRemoteCacheTier remote = new FakeRemoteCacheTier(clock);
    public final LocalCacheTier local = new LocalCacheTier(1000, clock);
    public final TieredCache cache = new TieredCache(remote, local, JacksonConfig.createObjectMapper(),
            clock, Duration.ofSeconds(60));
    public final FakeGossipClientFactory clientFactory = new FakeGossipClientFactory();
    public final NodeStatusResolver statusResolver = new NodeStatusResolver(300, clock);
    public final PNodeService pNodeService;
    public final NodeStatsService nodeStatsService;

    public ServiceFixture() {
        properties.getGossip().setSeeds(List.of(SEED));
        properties.getEnrichment().setBatchPause(Duration.ZERO);
        cache.initialize().block();

        NodeDiscoveryService discovery = new NodeDiscoveryService(
                List.of(DiscoveryStrategy.primary(
                        clientFactory.forEndpoint(SEED, 6000, Duration.ofSeconds(5)), Duration.ofSeconds(5))),
                new PodNormalizer(statusResolver));
        pNodeService = new PNodeService(cache, discovery, statusResolver);
        nodeStatsService = new NodeStatsService(cache, pNodeService, clientFactory, properties);
    }

    public FakeGossipClient seed() {
        return clientFactory.client(SEED);
    }

    public void gossip(List<RawPod> pods) {
        seed().podsWithStats(() -> Mono.just(pods));
    }
}
