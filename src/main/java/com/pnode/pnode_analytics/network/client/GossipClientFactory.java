package com.pnode.pnode_analytics.network.client;

import java.time.Duration;

public interface GossipClientFactory {

    GossipClient forEndpoint(String host, int port, Duration timeout);
}
