package com.pnode.pnode_analytics.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived per-node health figures, cached as the analytics snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeMetrics {
    private String pubkey;
    private String version;
    private NodeStatus status;
    private Long lastSeenTimestamp;     // epoch seconds, status is re-derived from it on read
    private double uptime24h;          // percent, 0-100
    private double storageUtilization;  // percent, 0-100
    private long storageUsed;
    private long storageCommitted;
    private int healthScore;            // 0-100
    private String tier;
}
