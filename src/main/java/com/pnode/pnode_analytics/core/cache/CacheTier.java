package com.pnode.pnode_analytics.core.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One backing store of the {@link TieredCache}. Values are opaque serialized strings.
 * <p>
 * A miss completes empty. An error signal means the tier itself could not answer
 * (connectivity or protocol failure), which is different from a miss.
 */
public interface CacheTier {

    String name();

    Mono<String> get(String key);

    Mono<Void> set(String key, String value, Duration ttl);

    Mono<Void> delete(String key);
}
