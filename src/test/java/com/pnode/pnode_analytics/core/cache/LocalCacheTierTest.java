package com.pnode.pnode_analytics.core.cache;

import com.pnode.pnode_analytics.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class LocalCacheTierTest {

    private MutableClock clock;
    private LocalCacheTier cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new LocalCacheTier(100, clock);
    }

    @Test
    void testValueAvailableUntilTtlElapses() {
        cache.set("k", "v", Duration.ofSeconds(30)).block();

        clock.advance(Duration.ofMillis(29_999));
        assertEquals("v", cache.get("k").block());

        clock.advance(Duration.ofMillis(1)); // exactly at expiry
        assertNull(cache.get("k").block());
    }

    @Test
    void testOverwriteResetsExpiry() {
        cache.set("k", "v1", Duration.ofSeconds(10)).block();
        clock.advance(Duration.ofSeconds(8));
        cache.set("k", "v2", Duration.ofSeconds(10)).block();
        clock.advance(Duration.ofSeconds(8));

        assertEquals("v2", cache.get("k").block());
    }

    @Test
    void testDelete() {
        cache.set("k", "v", Duration.ofSeconds(10)).block();
        cache.delete("k").block();

        assertNull(cache.get("k").block());
        assertEquals(1, cache.getDeleteCount());
    }

    @Test
    void testLeastRecentlyUsedEntryEvictedAtCapacity() {
        LocalCacheTier small = new LocalCacheTier(2, clock);
        small.set("a", "1", Duration.ofMinutes(1)).block();
        small.set("b", "2", Duration.ofMinutes(1)).block();
        small.get("a").block(); // a is now most recently used
        small.set("c", "3", Duration.ofMinutes(1)).block();

        assertEquals("1", small.get("a").block());
        assertNull(small.get("b").block());
        assertEquals("3", small.get("c").block());
    }

    @Test
    void testCountersAndSizeIgnoreExpiredEntries() {
        cache.set("short", "v", Duration.ofSeconds(1)).block();
        cache.set("long", "v", Duration.ofSeconds(60)).block();
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, cache.size());
        cache.get("long").block();
        cache.get("short").block();
        assertEquals(1, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
        assertEquals(0.5, cache.getHitRatio(), 0.0001);
    }

    @Test
    void testNonPositiveCapacityFallsBackToDefault() {
        LocalCacheTier unbounded = new LocalCacheTier(0, clock);
        for (int i = 0; i < 50; i++) {
            unbounded.set("k" + i, "v", Duration.ofMinutes(1)).block();
        }
        assertEquals(50, unbounded.size());
    }
}
