package com.pnode.pnode_analytics.core.cache;

import lombok.Getter;

import java.time.Duration;

@Getter
public enum CacheTtl {
    NODE_SET(Duration.ofSeconds(30)),
    NODE_STATS(Duration.ofSeconds(120)),
    ANALYTICS_SNAPSHOT(Duration.ofSeconds(60)),
    GEO(Duration.ofHours(24));

    private final Duration duration;

    CacheTtl(Duration duration) {
        this.duration = duration;
    }
}
