package com.pnode.pnode_analytics.core.cache;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CacheEntry {
    private String key;
    private String value; // serialized JSON
    private long expiresAtMillis;

    public static CacheEntry of(String key, String value, long nowMillis, long ttlMillis) {
        return new CacheEntry(key, value, nowMillis + ttlMillis);
    }

    // A read at or after expiresAt is a miss
    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAtMillis;
    }

}
