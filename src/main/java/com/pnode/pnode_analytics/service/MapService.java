package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.config.PNodeProperties;
import com.pnode.pnode_analytics.core.model.GeoLocation;
import com.pnode.pnode_analytics.core.model.GeoSummary;
import com.pnode.pnode_analytics.core.model.MapNode;
import com.pnode.pnode_analytics.core.model.NodeMetrics;
import com.pnode.pnode_analytics.core.model.PNode;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Nodes joined with their location and health, for map views. Nodes whose location cannot
 * be resolved are left out.
 */
@Service
public class MapService {

    private final PNodeService pNodeService;
    private final AnalyticsService analyticsService;
    private final GeoService geoService;
    private final int geoConcurrency;

    public MapService(PNodeService pNodeService,
                      AnalyticsService analyticsService,
                      GeoService geoService,
                      PNodeProperties properties) {
        this.pNodeService = pNodeService;
        this.analyticsService = analyticsService;
        this.geoService = geoService;
        this.geoConcurrency = Math.max(1, properties.getGeo().getConcurrency());
    }

    public Mono<List<MapNode>> getMapNodes() {
        return Mono.zip(pNodeService.getAllNodes(), analyticsService.getNodeMetrics())
                .flatMap(tuple -> {
                    Map<String, NodeMetrics> metricsByPubkey = tuple.getT2().stream()
                            .collect(Collectors.toMap(NodeMetrics::getPubkey, Function.identity(), (first, second) -> first));
                    return Flux.fromIterable(tuple.getT1())
                            .flatMapSequential(node -> geoService.resolveNodeGeo(addressOf(node))
                                            .map(geo -> toMapNode(node, geo, metricsByPubkey.get(node.getPubkey()))),
                                    geoConcurrency)
                            .collectList();
                });
    }

    public Mono<GeoSummary> getGeoSummary() {
        return getMapNodes().map(MapService::summarize);
    }

    static GeoSummary summarize(List<MapNode> mapNodes) {
        return new GeoSummary(
                countBy(mapNodes, MapNode::getCountry),
                countBy(mapNodes, MapNode::getRegion));
    }

    private static List<GeoSummary.Count> countBy(List<MapNode> mapNodes, Function<MapNode, String> key) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (MapNode node : mapNodes) {
            counts.merge(key.apply(node), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .map(e -> new GeoSummary.Count(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(GeoSummary.Count::getCount).reversed())
                .collect(Collectors.toList());
    }

    private static String addressOf(PNode node) {
        return node.getAddress() != null ? node.getAddress() : node.getIp();
    }

    private static MapNode toMapNode(PNode node, GeoLocation geo, NodeMetrics metrics) {
        return MapNode.builder()
                .pubkey(node.getPubkey())
                .lat(geo.getLat())
                .lng(geo.getLng())
                .country(geo.getCountry())
                .region(geo.getRegion())
                .status(node.getStatus())
                .healthScore(metrics != null ? metrics.getHealthScore() : 0)
                .uptime24h(metrics != null ? metrics.getUptime24h() : 0)
                .storageUtilization(metrics != null ? metrics.getStorageUtilization() : 0)
                .version(node.getVersion())
                .lastSeenTimestamp(node.getLastSeenTimestamp())
                .build();
    }
}
