package com.pnode.pnode_analytics.network.client;

import com.pnode.pnode_analytics.core.model.NodeStats;
import com.pnode.pnode_analytics.network.model.JsonRpcRequest;
import com.pnode.pnode_analytics.network.model.JsonRpcResponse;
import com.pnode.pnode_analytics.network.model.PodsResult;
import com.pnode.pnode_analytics.network.model.RawPod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * JSON-RPC 2.0 client for a single pRPC endpoint ({@code POST http://host:port/rpc}).
 */
public class PrpcClient implements GossipClient {
    private static final Logger log = LoggerFactory.getLogger(PrpcClient.class);

    static final String METHOD_PODS_WITH_STATS = "get-pods-with-stats";
    static final String METHOD_PODS = "get-pods";
    static final String METHOD_STATS = "get-stats";

    private static final ParameterizedTypeReference<JsonRpcResponse<PodsResult>> PODS_RESPONSE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<JsonRpcResponse<NodeStats>> STATS_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final String host;
    private final int port;
    private final Duration timeout;

    public PrpcClient(WebClient webClient, String host, int port, Duration timeout) {
        this.webClient = webClient;
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public String endpoint() {
        return host + ":" + port;
    }

    @Override
    public Mono<List<RawPod>> getPodsWithStats() {
        return call(METHOD_PODS_WITH_STATS, PODS_RESPONSE).map(PrpcClient::podsOf);
    }

    @Override
    public Mono<List<RawPod>> getPods() {
        return call(METHOD_PODS, PODS_RESPONSE).map(PrpcClient::podsOf);
    }

    @Override
    public Mono<NodeStats> getStats() {
        return call(METHOD_STATS, STATS_RESPONSE);
    }

    private <T> Mono<T> call(String method, ParameterizedTypeReference<JsonRpcResponse<T>> responseType) {
        String url = rpcUrl(host, port);
        log.debug("pRPC {} -> {}", method, endpoint());

        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(JsonRpcRequest.of(method))
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse -> {
                    log.debug("pRPC {} on {} answered with status {}", method, endpoint(), clientResponse.statusCode());
                    return clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(errorBody -> Mono.error(new PrpcException(
                                    method + " failed with status " + clientResponse.statusCode().value())));
                })
                .bodyToMono(responseType)
                .timeout(timeout)
                .flatMap(response -> {
                    if (response.getError() != null) {
                        return Mono.error(new PrpcException(method + " returned error " + response.getError().getCode()
                                + ": " + response.getError().getMessage()));
                    }
                    if (response.getResult() == null) {
                        return Mono.error(new PrpcException(method + " returned no result"));
                    }
                    return Mono.just(response.getResult());
                })
                .switchIfEmpty(Mono.error(() -> new PrpcException(method + " returned an empty body")))
                .doOnError(WebClientRequestException.class, e ->
                        log.debug("Network error calling {} on {}: {}", method, endpoint(), e.getMessage()));
    }

    // IPv6 literals must be bracketed inside a URL authority
    static String rpcUrl(String host, int port) {
        String authorityHost = host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
        return String.format("http://%s:%d/rpc", authorityHost, port);
    }

    private static List<RawPod> podsOf(PodsResult result) {
        return result.getPods() == null ? Collections.emptyList() : result.getPods();
    }
}
