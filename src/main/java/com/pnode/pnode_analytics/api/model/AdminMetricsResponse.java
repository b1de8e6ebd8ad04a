package com.pnode.pnode_analytics.api.model;

import com.pnode.pnode_analytics.service.EnrichmentReport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AdminMetricsResponse {
    private boolean remoteCacheAvailable;

    private int localKeyCount;
    private long localHitCount;
    private long localMissCount;
    private double localHitRatio;
    private long localPutCount;
    private long localDeleteCount;

    private long usedMemoryBytes;
    private long totalJvmMemoryBytes;

    private boolean enrichmentStarted;
    private boolean enrichmentRunning;
    private long enrichmentRunCount;
    private long enrichmentSkippedTicks;
    private EnrichmentReport lastEnrichmentRun; // null until the first run completes
}
