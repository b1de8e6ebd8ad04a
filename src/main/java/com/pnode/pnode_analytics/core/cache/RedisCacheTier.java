package com.pnode.pnode_analytics.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed remote tier. Redis enforces TTL itself through {@code SET ... PX}.
 */
public class RedisCacheTier implements RemoteCacheTier {
    private static final Logger log = LoggerFactory.getLogger(RedisCacheTier.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final boolean enabled;
    private final Duration timeout;

    public RedisCacheTier(ReactiveStringRedisTemplate redisTemplate, boolean enabled, Duration timeout) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key)
                .timeout(timeout);
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl)
                .timeout(timeout)
                .flatMap(stored -> stored
                        ? Mono.<Void>empty()
                        : Mono.error(new IllegalStateException("Redis rejected SET for key '" + key + "'")));
    }

    @Override
    public Mono<Void> delete(String key) {
        return redisTemplate.delete(key)
                .timeout(timeout)
                .then();
    }

    @Override
    public Mono<Boolean> probe() {
        if (!enabled) {
            log.info("Redis cache tier disabled by configuration (pnode.cache.remote.enabled=false).");
            return Mono.just(false);
        }
        return redisTemplate.execute(connection -> connection.ping())
                .next()
                .timeout(timeout)
                .map("PONG"::equalsIgnoreCase)
                .defaultIfEmpty(false)
                .doOnNext(ok -> log.info("Redis probe answered: {}", ok ? "PONG" : "unexpected reply"))
                .onErrorResume(e -> {
                    log.warn("Redis unreachable: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
