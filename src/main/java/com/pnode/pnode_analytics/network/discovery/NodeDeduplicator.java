package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.core.model.PNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class NodeDeduplicator {

    private NodeDeduplicator() {
    }

    /**
     * Keeps the first node seen for every pubkey, in order of first appearance.
     * Nodes without a pubkey are dropped.
     */
    public static List<PNode> firstSeenWins(List<PNode> nodes) {
        Map<String, PNode> seen = new LinkedHashMap<>();
        for (PNode node : nodes) {
            if (node == null || node.getPubkey() == null) {
                continue;
            }
            seen.putIfAbsent(node.getPubkey(), node);
        }
        return new ArrayList<>(seen.values());
    }
}
