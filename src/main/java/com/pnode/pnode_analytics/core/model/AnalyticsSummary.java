package com.pnode.pnode_analytics.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsSummary {
    private int totalNodes;
    private int onlineNodes;
    private int offlineNodes;
    private long totalStorageCommitted;
    private long totalStorageUsed;
    private double averageUptime24h;
    private double averageHealthScore;
    private double averageStorageUtilization;
    private int distinctVersions;
}
