package com.pnode.pnode_analytics.config;

import com.pnode.pnode_analytics.network.discovery.DiscoveryStrategy;
import com.pnode.pnode_analytics.support.FakeGossipClientFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DiscoveryConfigTest {

    @Test
    void testStrategiesFollowSeedOrder() {
        PNodeProperties.GossipProperties gossip = new PNodeProperties.GossipProperties();
        gossip.setSeeds(List.of("seed-a", "seed-b", "seed-c"));
        gossip.setPrimaryTimeout(Duration.ofSeconds(10));
        gossip.setFallbackTimeout(Duration.ofSeconds(5));
        FakeGossipClientFactory factory = new FakeGossipClientFactory();

        List<DiscoveryStrategy> strategies = DiscoveryConfig.discoveryStrategies(gossip, factory);

        assertEquals(List.of("primary seed-a", "fallback seed-b", "fallback seed-c"),
                strategies.stream().map(DiscoveryStrategy::getName).collect(Collectors.toList()));
        assertEquals(Duration.ofSeconds(20), strategies.get(0).getTimeout(), "primary covers both listing calls");
        assertEquals(Duration.ofSeconds(5), strategies.get(1).getTimeout());
        assertEquals(List.of("seed-a", "seed-b", "seed-c"), factory.requestedHosts);
    }

    @Test
    void testNoSeedsIsAConfigurationError() {
        PNodeProperties.GossipProperties gossip = new PNodeProperties.GossipProperties();
        assertThrows(IllegalStateException.class,
                () -> DiscoveryConfig.discoveryStrategies(gossip, new FakeGossipClientFactory()));
    }
}
