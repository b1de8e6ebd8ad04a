package com.pnode.pnode_analytics.api;

import com.pnode.pnode_analytics.core.model.AnalyticsSummary;
import com.pnode.pnode_analytics.core.model.GeoSummary;
import com.pnode.pnode_analytics.core.model.NodeMetrics;
import com.pnode.pnode_analytics.core.model.VersionCount;
import com.pnode.pnode_analytics.service.AnalyticsService;
import com.pnode.pnode_analytics.service.MapService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final MapService mapService;

    public AnalyticsController(AnalyticsService analyticsService, MapService mapService) {
        this.analyticsService = analyticsService;
        this.mapService = mapService;
    }

    @GetMapping("/summary")
    public Mono<AnalyticsSummary> getSummary() {
        return analyticsService.getSummary();
    }

    @GetMapping("/versions")
    public Mono<List<VersionCount>> getVersions() {
        return analyticsService.getVersionDistribution();
    }

    @GetMapping("/storage")
    public Mono<List<NodeMetrics>> getStorage() {
        return analyticsService.getStorageAnalytics();
    }

    @GetMapping("/node-metrics")
    public Mono<List<NodeMetrics>> getNodeMetrics() {
        return analyticsService.getNodeMetrics();
    }

    @GetMapping("/top-nodes")
    public Mono<List<NodeMetrics>> getTopNodes(@RequestParam(defaultValue = "10") int limit) {
        return analyticsService.getTopNodes(limit);
    }

    @GetMapping("/geo-summary")
    public Mono<GeoSummary> getGeoSummary() {
        return mapService.getGeoSummary();
    }
}
