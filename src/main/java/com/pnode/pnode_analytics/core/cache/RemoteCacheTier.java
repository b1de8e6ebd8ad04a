package com.pnode.pnode_analytics.core.cache;

import reactor.core.publisher.Mono;

/**
 * A shared cache tier living outside the process.
 */
public interface RemoteCacheTier extends CacheTier {

    /**
     * Connectivity probe. Emits {@code true} if the store answered, {@code false} otherwise.
     * Never errors.
     */
    Mono<Boolean> probe();
}
