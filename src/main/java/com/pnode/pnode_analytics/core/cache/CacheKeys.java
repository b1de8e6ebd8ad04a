package com.pnode.pnode_analytics.core.cache;

/**
 * Cache key namespaces. Every data class owns one prefix, see {@link CacheTtl} for lifetimes.
 */
public final class CacheKeys {

    public static final String NODE_SET = "pnodes";
    public static final String ANALYTICS_SNAPSHOT = "analytics:node_metrics";

    private static final String NODE_STATS_PREFIX = "node_stats:";
    private static final String GEO_PREFIX = "geo:";

    private CacheKeys() {
    }

    public static String nodeStats(String pubkey) {
        return NODE_STATS_PREFIX + pubkey;
    }

    public static String geo(String ip) {
        return GEO_PREFIX + ip;
    }
}
