package com.pnode.pnode_analytics.config;

import com.pnode.pnode_analytics.network.client.GossipClientFactory;
import com.pnode.pnode_analytics.network.discovery.DiscoveryStrategy;
import com.pnode.pnode_analytics.network.discovery.NodeDiscoveryService;
import com.pnode.pnode_analytics.network.discovery.NodeStatusResolver;
import com.pnode.pnode_analytics.network.discovery.PodNormalizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class DiscoveryConfig {

    @Bean
    public NodeStatusResolver nodeStatusResolver(PNodeProperties properties, Clock clock) {
        return new NodeStatusResolver(properties.getOnlineThresholdSeconds(), clock);
    }

    @Bean
    public PodNormalizer podNormalizer(NodeStatusResolver nodeStatusResolver) {
        return new PodNormalizer(nodeStatusResolver);
    }

    @Bean
    public NodeDiscoveryService nodeDiscoveryService(PNodeProperties properties,
                                                     GossipClientFactory clientFactory,
                                                     PodNormalizer podNormalizer) {
        return new NodeDiscoveryService(discoveryStrategies(properties.getGossip(), clientFactory), podNormalizer);
    }

    /**
     * Fallback chain in order: the first seed with the stats listing (then the plain one),
     * followed by the remaining seeds with the plain listing.
     */
    static List<DiscoveryStrategy> discoveryStrategies(PNodeProperties.GossipProperties gossip,
                                                       GossipClientFactory clientFactory) {
        List<String> seeds = gossip.getSeeds();
        if (seeds == null || seeds.isEmpty()) {
            throw new IllegalStateException("At least one gossip seed must be configured (pnode.gossip.seeds).");
        }
        List<DiscoveryStrategy> strategies = new ArrayList<>();
        strategies.add(DiscoveryStrategy.primary(
                clientFactory.forEndpoint(seeds.get(0), gossip.getRpcPort(), gossip.getPrimaryTimeout()),
                gossip.getPrimaryTimeout()));
        for (String seed : seeds.subList(1, seeds.size())) {
            strategies.add(DiscoveryStrategy.fallback(
                    clientFactory.forEndpoint(seed, gossip.getRpcPort(), gossip.getFallbackTimeout()),
                    gossip.getFallbackTimeout()));
        }
        return strategies;
    }
}
