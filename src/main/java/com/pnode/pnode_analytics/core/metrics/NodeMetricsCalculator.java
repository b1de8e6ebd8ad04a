package com.pnode.pnode_analytics.core.metrics;

import com.pnode.pnode_analytics.core.model.NodeMetrics;
import com.pnode.pnode_analytics.core.model.NodeStatus;
import com.pnode.pnode_analytics.core.model.PNode;

public final class NodeMetricsCalculator {

    public static final String TIER_EXCELLENT = "Excellent";
    public static final String TIER_GOOD = "Good";
    public static final String TIER_POOR = "Poor";

    private static final double SECONDS_PER_DAY = 86400.0;

    private NodeMetricsCalculator() {
    }

    /**
     * Uptime as a percentage of the last 24 hours, capped at 100.
     */
    public static double uptime24h(long uptimeSeconds) {
        if (uptimeSeconds <= 0) {
            return 0;
        }
        return round2(Math.min(uptimeSeconds / SECONDS_PER_DAY * 100, 100));
    }

    public static double utilization(long used, long total) {
        if (total <= 0) {
            return 0;
        }
        return round2((double) used / total * 100);
    }

    /**
     * Weighted score: 50% uptime, 30% free storage, 20% online.
     * Utilization is clamped to 0-100 before weighting, the result to 0-100 after.
     */
    public static int healthScore(double uptime24h, double utilization, boolean online) {
        double clampedUtilization = clamp(utilization);
        double score = uptime24h * 0.5
                + (100 - clampedUtilization) * 0.3
                + (online ? 100 : 0) * 0.2;
        return (int) Math.round(clamp(score));
    }

    public static String tier(int healthScore) {
        if (healthScore >= 90) {
            return TIER_EXCELLENT;
        }
        if (healthScore >= 75) {
            return TIER_GOOD;
        }
        return TIER_POOR;
    }

    public static NodeMetrics metricsFor(PNode node) {
        long used = valueOrZero(node.getStorageUsed());
        long committed = valueOrZero(node.getStorageCommitted());
        double uptime = uptime24h(valueOrZero(node.getUptime()));
        double utilization = utilization(used, committed);
        int score = healthScore(uptime, utilization, node.isOnline());
        return NodeMetrics.builder()
                .pubkey(node.getPubkey())
                .version(node.getVersion())
                .status(node.getStatus())
                .lastSeenTimestamp(node.getLastSeenTimestamp())
                .uptime24h(uptime)
                .storageUtilization(utilization)
                .storageUsed(used)
                .storageCommitted(committed)
                .healthScore(score)
                .tier(tier(score))
                .build();
    }

    /**
     * The same metrics under a different status; the online share of the score follows it.
     */
    public static NodeMetrics withStatus(NodeMetrics metrics, NodeStatus status) {
        if (metrics.getStatus() == status) {
            return metrics;
        }
        int score = healthScore(metrics.getUptime24h(), metrics.getStorageUtilization(), status == NodeStatus.ONLINE);
        return metrics.toBuilder()
                .status(status)
                .healthScore(score)
                .tier(tier(score))
                .build();
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(100, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0 : value;
    }
}
