package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.config.PNodeProperties;
import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.core.model.NodeStats;
import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.client.FailureClassifier;
import com.pnode.pnode_analytics.network.client.GossipClientFactory;
import com.pnode.pnode_analytics.network.client.PrpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Per-node resource stats, fetched from the node itself rather than through gossip.
 */
@Service
public class NodeStatsService {

    private static final Logger log = LoggerFactory.getLogger(NodeStatsService.class);

    private final TieredCache cache;
    private final PNodeService pNodeService;
    private final GossipClientFactory clientFactory;
    private final int defaultRpcPort;
    private final Duration statsTimeout;

    public NodeStatsService(TieredCache cache,
                            PNodeService pNodeService,
                            GossipClientFactory clientFactory,
                            PNodeProperties properties) {
        this.cache = cache;
        this.pNodeService = pNodeService;
        this.clientFactory = clientFactory;
        this.defaultRpcPort = properties.getGossip().getRpcPort();
        this.statsTimeout = properties.getGossip().getStatsTimeout();
    }

    /**
     * Cached stats if warm, otherwise a direct fetch. Completes empty when the node is unknown,
     * offline (no network call is made), or unreachable.
     */
    public Mono<NodeStats> getNodeStats(String pubkey) {
        return cache.get(CacheKeys.nodeStats(pubkey), NodeStats.class)
                .switchIfEmpty(Mono.defer(() -> pNodeService.getNodeByPubkey(pubkey)
                        .filter(PNode::isOnline)
                        .flatMap(node -> fetchAndCache(node)
                                .onErrorResume(e -> {
                                    logFailure(node, e);
                                    return Mono.empty();
                                }))));
    }

    /**
     * Fetches stats straight from the node and writes them under the node's stats key.
     * Errors are signalled to the caller so batch callers can count them.
     */
    public Mono<NodeStats> fetchAndCache(PNode node) {
        if (node.getIp() == null || node.getIp().isEmpty()) {
            return Mono.error(new PrpcException("node " + node.getPubkey() + " has no address"));
        }
        int port = node.getRpcPort() != null ? node.getRpcPort() : defaultRpcPort;
        return clientFactory.forEndpoint(node.getIp(), port, statsTimeout)
                .getStats()
                .flatMap(stats -> cache.set(CacheKeys.nodeStats(node.getPubkey()), stats, CacheTtl.NODE_STATS)
                        .thenReturn(stats));
    }

    void logFailure(PNode node, Throwable e) {
        if (FailureClassifier.isTransient(e)) {
            log.debug("Stats unavailable for node {} ({}): {}", node.getPubkey(), node.getIp(), e.toString());
        } else {
            log.warn("Unexpected error fetching stats for node {} ({}): {}", node.getPubkey(), node.getIp(), e.toString());
        }
    }
}
