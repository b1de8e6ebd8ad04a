package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.core.model.NodeStatus;
import com.pnode.pnode_analytics.core.model.PNode;

import java.time.Clock;
import java.time.Instant;

/**
 * Derives online/offline from a last-seen timestamp. A node is online iff it was seen
 * strictly less than the threshold ago; a node seen exactly at the threshold is offline.
 */
public class NodeStatusResolver {

    private final long thresholdMillis;
    private final Clock clock;

    public NodeStatusResolver(long onlineThresholdSeconds, Clock clock) {
        this.thresholdMillis = onlineThresholdSeconds * 1000;
        this.clock = clock;
    }

    public NodeStatus resolve(Long lastSeenTimestamp) {
        return resolve(lastSeenTimestamp, clock.instant());
    }

    public NodeStatus resolve(Long lastSeenTimestamp, Instant now) {
        if (lastSeenTimestamp == null) {
            return NodeStatus.OFFLINE;
        }
        long ageMillis = now.toEpochMilli() - lastSeenTimestamp * 1000;
        return ageMillis < thresholdMillis ? NodeStatus.ONLINE : NodeStatus.OFFLINE;
    }

    /**
     * Copy of the node with its status recomputed for the current time.
     */
    public PNode refresh(PNode node) {
        NodeStatus status = resolve(node.getLastSeenTimestamp());
        if (status == node.getStatus()) {
            return node;
        }
        return node.toBuilder().status(status).build();
    }
}
