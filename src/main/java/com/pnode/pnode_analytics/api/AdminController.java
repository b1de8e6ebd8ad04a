package com.pnode.pnode_analytics.api;


import com.pnode.pnode_analytics.api.model.AdminMetricsResponse;
import com.pnode.pnode_analytics.api.model.HealthResponse;
import com.pnode.pnode_analytics.core.cache.LocalCacheTier;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.service.PNodeService;
import com.pnode.pnode_analytics.service.StatsEnrichmentScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@RestController
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final TieredCache tieredCache;
    private final StatsEnrichmentScheduler enrichmentScheduler;
    private final PNodeService pNodeService;
    private final Clock clock;

    public AdminController(TieredCache tieredCache,
                           StatsEnrichmentScheduler enrichmentScheduler,
                           PNodeService pNodeService,
                           Clock clock) {
        this.tieredCache = tieredCache;
        this.enrichmentScheduler = enrichmentScheduler;
        this.pNodeService = pNodeService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", clock.instant(), tieredCache.isRemoteAvailable() ? "up" : "down");
    }

    /**
     * Cache tier counters and the state of stats enrichment.
     */
    @GetMapping("/admin/stats")
    public ResponseEntity<AdminMetricsResponse> getAdminStats() {
        AdminMetricsResponse response = new AdminMetricsResponse();
        LocalCacheTier local = tieredCache.getLocalTier();

        response.setRemoteCacheAvailable(tieredCache.isRemoteAvailable());
        response.setLocalKeyCount(local.size());
        response.setLocalHitCount(local.getHitCount());
        response.setLocalMissCount(local.getMissCount());
        response.setLocalHitRatio(local.getHitRatio());
        response.setLocalPutCount(local.getPutCount());
        response.setLocalDeleteCount(local.getDeleteCount());

        Runtime runtime = Runtime.getRuntime();
        response.setUsedMemoryBytes(runtime.totalMemory() - runtime.freeMemory());
        response.setTotalJvmMemoryBytes(runtime.totalMemory());

        response.setEnrichmentStarted(enrichmentScheduler.isStarted());
        response.setEnrichmentRunning(enrichmentScheduler.isRunning());
        response.setEnrichmentRunCount(enrichmentScheduler.getRunCount());
        response.setEnrichmentSkippedTicks(enrichmentScheduler.getSkippedTicks());
        response.setLastEnrichmentRun(enrichmentScheduler.getLastReport());

        log.debug("AdminController: local keys={}, hits={}, remote up={}",
                response.getLocalKeyCount(), response.getLocalHitCount(), response.isRemoteCacheAvailable());

        return new ResponseEntity<>(response, HttpStatus.OK);
    }

    @PostMapping("/admin/refresh")
    public Mono<Map<String, Integer>> refresh() {
        return pNodeService.refresh().map(nodes -> Map.of("nodes", nodes.size()));
    }
}
