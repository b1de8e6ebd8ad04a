package com.pnode.pnode_analytics.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.core.model.NodeStats;
import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.discovery.NodeDeduplicator;
import com.pnode.pnode_analytics.network.discovery.NodeDiscoveryService;
import com.pnode.pnode_analytics.network.discovery.NodeStatusResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single read path for "all nodes".
 * <p>
 * The node set is cached for {@link CacheTtl#NODE_SET}. Whether it came from the cache or a
 * fresh discovery, every read recomputes online status and merges in the warm per-node stats
 * entries, which live longer than the node set itself.
 */
@Service
public class PNodeService {

    private static final Logger log = LoggerFactory.getLogger(PNodeService.class);
    private static final TypeReference<List<PNode>> NODE_LIST = new TypeReference<>() {
    };

    private final TieredCache cache;
    private final NodeDiscoveryService discoveryService;
    private final NodeStatusResolver statusResolver;

    // Concurrent misses share one discovery instead of each querying the seeds
    private final AtomicReference<Mono<List<PNode>>> discoveryInFlight = new AtomicReference<>();

    public PNodeService(TieredCache cache,
                        NodeDiscoveryService discoveryService,
                        NodeStatusResolver statusResolver) {
        this.cache = cache;
        this.discoveryService = discoveryService;
        this.statusResolver = statusResolver;
    }

    public Mono<List<PNode>> getAllNodes() {
        return cache.get(CacheKeys.NODE_SET, NODE_LIST)
                .doOnNext(nodes -> log.debug("Using cached pNodes ({} nodes)", nodes.size()))
                .switchIfEmpty(Mono.defer(this::sharedDiscovery))
                .flatMap(this::enrichWithCachedStats);
    }

    /**
     * Pure lookup over {@link #getAllNodes()}, so a single node is always consistent with
     * the bulk listing. Completes empty when the pubkey is unknown.
     */
    public Mono<PNode> getNodeByPubkey(String pubkey) {
        return getAllNodes().flatMap(nodes -> Mono.justOrEmpty(nodes.stream()
                .filter(node -> node.getPubkey().equals(pubkey))
                .findFirst()));
    }

    /**
     * Drops the cached node set and rediscovers. Maintenance use only.
     */
    public Mono<List<PNode>> refresh() {
        log.info("Refreshing pNode set on request");
        return cache.delete(CacheKeys.NODE_SET).then(getAllNodes());
    }

    private Mono<List<PNode>> sharedDiscovery() {
        Mono<List<PNode>> existing = discoveryInFlight.get();
        if (existing != null) {
            return existing;
        }
        Mono<List<PNode>> created = discoverAndCache()
                .doFinally(signal -> discoveryInFlight.set(null))
                .cache();
        if (discoveryInFlight.compareAndSet(null, created)) {
            return created;
        }
        Mono<List<PNode>> winner = discoveryInFlight.get();
        return winner != null ? winner : created;
    }

    private Mono<List<PNode>> discoverAndCache() {
        log.info("Discovering pNodes via gossip (cache miss)");
        return discoveryService.discover()
                .map(NodeDeduplicator::firstSeenWins)
                .flatMap(nodes -> {
                    long online = nodes.stream().filter(PNode::isOnline).count();
                    log.info("Discovered {} unique nodes ({} online, {} offline)", nodes.size(), online, nodes.size() - online);
                    return cache.set(CacheKeys.NODE_SET, nodes, CacheTtl.NODE_SET)
                            .onErrorResume(e -> {
                                log.error("Failed to cache discovered node set", e);
                                return Mono.empty();
                            })
                            .thenReturn(nodes);
                });
    }

    private Mono<List<PNode>> enrichWithCachedStats(List<PNode> nodes) {
        return Flux.fromIterable(nodes)
                .map(statusResolver::refresh)
                .flatMapSequential(node -> cache.get(CacheKeys.nodeStats(node.getPubkey()), NodeStats.class)
                        .map(stats -> mergeStats(node, stats))
                        .defaultIfEmpty(node))
                .collectList();
    }

    // Adds resource fields only; discovery-derived fields stay as discovered
    static PNode mergeStats(PNode node, NodeStats stats) {
        return node.toBuilder()
                .ramUsed(stats.getRamUsed())
                .ramTotal(stats.getRamTotal())
                .cpuPercent(stats.getCpuPercent())
                .build();
    }
}
