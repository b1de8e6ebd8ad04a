package com.pnode.pnode_analytics.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.core.metrics.NodeMetricsCalculator;
import com.pnode.pnode_analytics.core.model.AnalyticsSummary;
import com.pnode.pnode_analytics.core.model.NodeMetrics;
import com.pnode.pnode_analytics.core.model.NodeStatus;
import com.pnode.pnode_analytics.core.model.VersionCount;
import com.pnode.pnode_analytics.network.discovery.NodeStatusResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);
    private static final TypeReference<List<NodeMetrics>> METRICS_LIST = new TypeReference<>() {
    };
    private static final String UNKNOWN_VERSION = "unknown";

    private final TieredCache cache;
    private final PNodeService pNodeService;
    private final NodeStatusResolver statusResolver;

    public AnalyticsService(TieredCache cache, PNodeService pNodeService, NodeStatusResolver statusResolver) {
        this.cache = cache;
        this.pNodeService = pNodeService;
        this.statusResolver = statusResolver;
    }

    /**
     * Per-node metrics snapshot, recomputed from the node set at most once per
     * {@link CacheTtl#ANALYTICS_SNAPSHOT}. Online status, and the health score share that
     * depends on it, is re-derived from the last-seen time on every read, so counts agree
     * with the node listing.
     */
    public Mono<List<NodeMetrics>> getNodeMetrics() {
        return cache.get(CacheKeys.ANALYTICS_SNAPSHOT, METRICS_LIST)
                .switchIfEmpty(Mono.defer(() -> pNodeService.getAllNodes()
                        .map(nodes -> nodes.stream()
                                .map(NodeMetricsCalculator::metricsFor)
                                .collect(Collectors.toList()))
                        .flatMap(metrics -> cache.set(CacheKeys.ANALYTICS_SNAPSHOT, metrics, CacheTtl.ANALYTICS_SNAPSHOT)
                                .thenReturn(metrics))
                        .doOnNext(metrics -> log.debug("Computed metrics snapshot for {} nodes", metrics.size()))))
                .map(this::refreshStatus);
    }

    private List<NodeMetrics> refreshStatus(List<NodeMetrics> metrics) {
        return metrics.stream()
                .map(m -> NodeMetricsCalculator.withStatus(m, statusResolver.resolve(m.getLastSeenTimestamp())))
                .collect(Collectors.toList());
    }

    public Mono<AnalyticsSummary> getSummary() {
        return getNodeMetrics().map(AnalyticsService::summarize);
    }

    public Mono<List<VersionCount>> getVersionDistribution() {
        return getNodeMetrics().map(AnalyticsService::versionDistribution);
    }

    public Mono<List<NodeMetrics>> getStorageAnalytics() {
        return getNodeMetrics().map(metrics -> metrics.stream()
                .sorted(Comparator.comparingLong(NodeMetrics::getStorageCommitted).reversed())
                .collect(Collectors.toList()));
    }

    public Mono<List<NodeMetrics>> getTopNodes(int limit) {
        return getNodeMetrics().map(metrics -> metrics.stream()
                .sorted(Comparator.comparingInt(NodeMetrics::getHealthScore).reversed()
                        .thenComparing(Comparator.comparingDouble(NodeMetrics::getUptime24h).reversed()))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList()));
    }

    static AnalyticsSummary summarize(List<NodeMetrics> metrics) {
        int online = (int) metrics.stream().filter(m -> m.getStatus() == NodeStatus.ONLINE).count();
        return AnalyticsSummary.builder()
                .totalNodes(metrics.size())
                .onlineNodes(online)
                .offlineNodes(metrics.size() - online)
                .totalStorageCommitted(metrics.stream().mapToLong(NodeMetrics::getStorageCommitted).sum())
                .totalStorageUsed(metrics.stream().mapToLong(NodeMetrics::getStorageUsed).sum())
                .averageUptime24h(round2(metrics.stream().mapToDouble(NodeMetrics::getUptime24h).average().orElse(0)))
                .averageHealthScore(round2(metrics.stream().mapToInt(NodeMetrics::getHealthScore).average().orElse(0)))
                .averageStorageUtilization(round2(metrics.stream().mapToDouble(NodeMetrics::getStorageUtilization).average().orElse(0)))
                .distinctVersions((int) metrics.stream().map(AnalyticsService::versionOf).distinct().count())
                .build();
    }

    static List<VersionCount> versionDistribution(List<NodeMetrics> metrics) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NodeMetrics m : metrics) {
            counts.merge(versionOf(m), 1, Integer::sum);
        }
        int total = metrics.size();
        return counts.entrySet().stream()
                .map(e -> new VersionCount(e.getKey(), e.getValue(), total == 0 ? 0 : round2(e.getValue() * 100.0 / total)))
                .sorted(Comparator.comparingInt(VersionCount::getCount).reversed())
                .collect(Collectors.toList());
    }

    private static String versionOf(NodeMetrics metrics) {
        return metrics.getVersion() == null || metrics.getVersion().isEmpty() ? UNKNOWN_VERSION : metrics.getVersion();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
