package com.pnode.pnode_analytics.network.client;

import com.pnode.pnode_analytics.core.model.NodeStats;
import com.pnode.pnode_analytics.network.model.RawPod;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * pRPC calls against one endpoint. Every call is bounded by the endpoint's timeout and
 * signals an error on timeout, transport failure or JSON-RPC error.
 */
public interface GossipClient {

    String endpoint();

    /** Bulk pod listing including per-pod storage and uptime. */
    Mono<List<RawPod>> getPodsWithStats();

    /** Reduced bulk listing, still served by endpoints that reject the stats variant. */
    Mono<List<RawPod>> getPods();

    /** Resource stats of the node serving this endpoint. */
    Mono<NodeStats> getStats();
}
