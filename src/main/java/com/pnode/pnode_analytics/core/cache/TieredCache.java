package com.pnode.pnode_analytics.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Key/value cache backed by a remote tier with a local in-process fallback.
 * <p>
 * Reads go to the remote tier while it is reachable and treat its answer as authoritative.
 * Any remote failure marks the remote tier down and the read is served by the local tier
 * instead; callers cannot tell the two apart. Writes always land in the local tier as a
 * shadow copy, whether or not the remote write succeeded.
 * <p>
 * Until {@link #initialize()} has completed, and while the remote tier is marked down, only
 * the local tier is used. A down remote tier is re-probed in the background at most once per
 * retry interval.
 */
public class TieredCache {
    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    private final RemoteCacheTier remote;
    private final LocalCacheTier local;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration retryInterval;

    private final AtomicBoolean remoteAvailable = new AtomicBoolean(false);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean probeInFlight = new AtomicBoolean(false);
    private final AtomicLong lastProbeAtMillis = new AtomicLong(0);

    public TieredCache(RemoteCacheTier remote, LocalCacheTier local, ObjectMapper objectMapper,
                       Clock clock, Duration retryInterval) {
        this.remote = remote;
        this.local = local;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retryInterval = retryInterval;
    }

    /**
     * Probes the remote tier once. Completes with the probe result and never errors,
     * so startup can chain on it without handling failure.
     */
    public Mono<Boolean> initialize() {
        return probeRemote()
                .doOnNext(available -> {
                    initialized.set(true);
                    if (available) {
                        log.info("TieredCache: remote tier '{}' is up, using it as primary store.", remote.name());
                    } else {
                        log.warn("TieredCache: remote tier '{}' unavailable, continuing on the local tier.", remote.name());
                    }
                });
    }

    public <T> Mono<T> get(String key, Class<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> Mono<T> get(String key, JavaType type) {
        return readRaw(key).flatMap(raw -> Mono.justOrEmpty(this.<T>deserialize(key, raw, type)));
    }

    public Mono<Void> set(String key, Object value, Duration ttl) {
        final String raw;
        try {
            raw = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalArgumentException("Cannot serialize value for cache key '" + key + "'", e));
        }
        // Tier routing is decided at subscription, not when the Mono is assembled
        return Mono.defer(() -> {
            Mono<Void> remoteWrite = useRemote()
                    ? remote.set(key, raw, ttl).onErrorResume(e -> {
                        markRemoteDown("SET", key, e);
                        return Mono.empty();
                    })
                    : Mono.empty();
            return remoteWrite.then(local.set(key, raw, ttl));
        });
    }

    public Mono<Void> set(String key, Object value, CacheTtl ttl) {
        return set(key, value, ttl.getDuration());
    }

    public Mono<Void> delete(String key) {
        return Mono.defer(() -> {
            Mono<Void> remoteDelete = useRemote()
                    ? remote.delete(key).onErrorResume(e -> {
                        markRemoteDown("DELETE", key, e);
                        return Mono.empty();
                    })
                    : Mono.empty();
            return remoteDelete.then(local.delete(key));
        });
    }

    public boolean isRemoteAvailable() {
        return remoteAvailable.get();
    }

    public LocalCacheTier getLocalTier() {
        return local;
    }

    private Mono<String> readRaw(String key) {
        return Mono.defer(() -> {
            if (!useRemote()) {
                return local.get(key);
            }
            return remote.get(key)
                    .onErrorResume(e -> {
                        markRemoteDown("GET", key, e);
                        return local.get(key);
                    });
        });
    }

    private boolean useRemote() {
        if (remoteAvailable.get()) {
            return true;
        }
        if (initialized.get()) {
            maybeReprobe();
        }
        return false;
    }

    private void markRemoteDown(String operation, String key, Throwable e) {
        if (remoteAvailable.compareAndSet(true, false)) {
            lastProbeAtMillis.set(clock.millis());
            log.warn("TieredCache: remote {} for key '{}' failed ({}). Falling back to local tier.",
                    operation, key, e.toString());
        } else {
            log.debug("TieredCache: remote {} for key '{}' failed: {}", operation, key, e.toString());
        }
    }

    private void maybeReprobe() {
        long now = clock.millis();
        if (now - lastProbeAtMillis.get() < retryInterval.toMillis()) {
            return;
        }
        if (!probeInFlight.compareAndSet(false, true)) {
            return;
        }
        probeRemote()
                .doFinally(signal -> probeInFlight.set(false))
                .subscribe(available -> {
                    if (available) {
                        log.info("TieredCache: remote tier '{}' is reachable again.", remote.name());
                    }
                });
    }

    private Mono<Boolean> probeRemote() {
        return remote.probe()
                .onErrorReturn(false)
                .defaultIfEmpty(false)
                .doOnNext(available -> {
                    lastProbeAtMillis.set(clock.millis());
                    remoteAvailable.set(available);
                });
    }

    private <T> T deserialize(String key, String raw, JavaType type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            // Unreadable entries (e.g. written by an older schema) are treated as a miss
            log.warn("TieredCache: discarding unreadable value for key '{}': {}", key, e.getOriginalMessage());
            return null;
        }
    }
}
