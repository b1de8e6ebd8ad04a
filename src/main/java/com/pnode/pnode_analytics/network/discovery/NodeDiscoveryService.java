package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.model.RawPod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Discovers the current pNode set through gossip.
 * <p>
 * Strategies are tried in order, each bounded by its own timeout, and the first one yielding
 * at least one usable node wins. A failing strategy counts as yielding nothing. If every
 * strategy is exhausted the result is an empty list rather than an error.
 */
public class NodeDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(NodeDiscoveryService.class);

    private final List<DiscoveryStrategy> strategies;
    private final PodNormalizer normalizer;

    public NodeDiscoveryService(List<DiscoveryStrategy> strategies, PodNormalizer normalizer) {
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
        this.normalizer = normalizer;
        log.info("NodeDiscoveryService initialized with strategies: {}", this.strategies);
    }

    public Mono<List<PNode>> discover() {
        return discoverWithSource().map(DiscoveryResult::getNodes);
    }

    /**
     * Same as {@link #discover()}, also naming the strategy that produced the nodes.
     */
    public Mono<DiscoveryResult> discoverWithSource() {
        return Flux.fromIterable(strategies)
                .concatMap(this::attempt)
                .filter(result -> !result.getNodes().isEmpty())
                .next()
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Discovery exhausted all {} strategies without finding a node.", strategies.size());
                    return DiscoveryResult.empty();
                }));
    }

    public List<DiscoveryStrategy> getStrategies() {
        return strategies;
    }

    private Mono<DiscoveryResult> attempt(DiscoveryStrategy strategy) {
        return strategy.fetch()
                .map(pods -> new DiscoveryResult(strategy.getName(), normalizeBatch(pods)))
                .doOnNext(result -> log.info("Discovery via {}: {} unique usable nodes",
                        strategy.getName(), result.getNodes().size()))
                .onErrorResume(e -> {
                    log.warn("Discovery via {} failed ({}), trying next strategy",
                            strategy.getName(), DiscoveryStrategy.describe(e));
                    return Mono.just(new DiscoveryResult(strategy.getName(), Collections.emptyList()));
                });
    }

    List<PNode> normalizeBatch(List<RawPod> pods) {
        List<PNode> normalized = new ArrayList<>(pods.size());
        int dropped = 0;
        for (RawPod pod : pods) {
            Optional<PNode> node = normalizer.normalize(pod);
            if (node.isPresent()) {
                normalized.add(node.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} of {} pod records without a usable identity", dropped, pods.size());
        }
        return NodeDeduplicator.firstSeenWins(normalized);
    }
}
