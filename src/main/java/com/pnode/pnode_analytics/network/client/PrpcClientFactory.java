package com.pnode.pnode_analytics.network.client;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class PrpcClientFactory implements GossipClientFactory {

    // Pod listings of the whole network exceed WebClient's default 256 KB buffer
    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final WebClient webClient;

    // Spring injects the Boot-configured builder, which already carries our ObjectMapper
    public PrpcClientFactory(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    @Override
    public GossipClient forEndpoint(String host, int port, Duration timeout) {
        return new PrpcClient(webClient, host, port, timeout);
    }
}
