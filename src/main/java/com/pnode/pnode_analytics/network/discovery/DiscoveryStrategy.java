package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.network.client.FailureClassifier;
import com.pnode.pnode_analytics.network.client.GossipClient;
import com.pnode.pnode_analytics.network.model.RawPod;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * One step of the discovery fallback chain: a named way to obtain a raw pod batch,
 * bounded by its own timeout.
 */
public final class DiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryStrategy.class);

    @Getter
    private final String name;
    @Getter
    private final Duration timeout;
    private final Supplier<Mono<List<RawPod>>> fetch;

    public DiscoveryStrategy(String name, Duration timeout, Supplier<Mono<List<RawPod>>> fetch) {
        this.name = name;
        this.timeout = timeout;
        this.fetch = fetch;
    }

    /**
     * Primary seed: the listing with embedded stats, retried once on the same endpoint
     * with the plain listing. The budget covers both calls.
     */
    public static DiscoveryStrategy primary(GossipClient client, Duration callTimeout) {
        return new DiscoveryStrategy("primary " + client.endpoint(), callTimeout.multipliedBy(2),
                () -> client.getPodsWithStats()
                        .onErrorResume(e -> {
                            log.info("get-pods-with-stats failed on {} ({}), retrying with get-pods",
                                    client.endpoint(), describe(e));
                            return client.getPods();
                        }));
    }

    public static DiscoveryStrategy fallback(GossipClient client, Duration callTimeout) {
        return new DiscoveryStrategy("fallback " + client.endpoint(), callTimeout, client::getPods);
    }

    public Mono<List<RawPod>> fetch() {
        return Mono.defer(fetch).timeout(timeout);
    }

    static String describe(Throwable e) {
        return FailureClassifier.isTransient(e) ? "unreachable: " + e.getClass().getSimpleName() : e.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
