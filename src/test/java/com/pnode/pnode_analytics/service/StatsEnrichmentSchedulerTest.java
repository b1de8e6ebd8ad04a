package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.support.ServiceFixture;
import com.pnode.pnode_analytics.support.TestPods;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatsEnrichmentSchedulerTest {

    private ServiceFixture fixture;
    private StatsEnrichmentScheduler scheduler;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        fixture.properties.getEnrichment().setBatchSize(2);
        fixture.gossip(Arrays.asList(
                TestPods.onlinePod("N1", "10.0.0.1:9001", fixture.clock),
                TestPods.onlinePod("N2", "10.0.0.2:9001", fixture.clock),
                TestPods.offlinePod("N3", "10.0.0.3:9001", fixture.clock),
                TestPods.onlinePod("N4", "10.0.0.4:9001", fixture.clock)));
        fixture.clientFactory.client("10.0.0.1").stats(() -> Mono.just(TestPods.stats(1, 10)));
        fixture.clientFactory.client("10.0.0.2").stats(() -> Mono.just(TestPods.stats(2, 10)));
        // 10.0.0.4 is left unscripted and refuses connections
        scheduler = new StatsEnrichmentScheduler(fixture.pNodeService, fixture.nodeStatsService,
                fixture.properties, fixture.clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void testRunFetchesOnlineNodesInBatches() {
        EnrichmentReport report = scheduler.runOnce().block();

        assertEquals(3, report.getOnlineNodes());
        assertEquals(2, report.getBatches());
        assertEquals(2, report.getSucceeded());
        assertEquals(1, report.getFailed());
        assertEquals("unreachable", report.getFailures().get("N4"));

        assertTrue(fixture.remote.contains(CacheKeys.nodeStats("N1")));
        assertTrue(fixture.remote.contains(CacheKeys.nodeStats("N2")));
        assertFalse(fixture.remote.contains(CacheKeys.nodeStats("N3")));
        assertFalse(fixture.clientFactory.requestedHosts.contains("10.0.0.3"), "offline nodes are not contacted");
    }

    @Test
    void testRunsAreIdempotent() {
        EnrichmentReport first = scheduler.runOnce().block();
        EnrichmentReport second = scheduler.runOnce().block();

        assertEquals(first.getSucceeded(), second.getSucceeded());
        assertEquals(first.getFailures(), second.getFailures());
        assertEquals(1L, fixture.pNodeService.getNodeByPubkey("N1").block().getRamUsed());
        assertEquals(2L, fixture.pNodeService.getNodeByPubkey("N2").block().getRamUsed());
    }

    @Test
    void testEmptyNodeSetProducesEmptyReport() {
        fixture.gossip(List.of());

        EnrichmentReport report = scheduler.runOnce().block();

        assertEquals(0, report.getOnlineNodes());
        assertEquals(0, report.getBatches());
        assertEquals(0, report.getSucceeded());
    }

    @Test
    void testTickWhileRunInProgressIsSkipped() {
        fixture.clientFactory.client("10.0.0.1").stats(Mono::never);

        assertTrue(scheduler.tick());
        assertTrue(scheduler.isRunning());
        assertFalse(scheduler.tick());

        assertEquals(1, scheduler.getRunCount());
        assertEquals(1, scheduler.getSkippedTicks());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testTickAfterCompletedRunStartsNewRun() {
        assertTrue(scheduler.tick());
        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.tick());

        assertEquals(2, scheduler.getRunCount());
        assertEquals(0, scheduler.getSkippedTicks());
        assertEquals(2, scheduler.getLastReport().getSucceeded());
    }

    @Test
    void testStartIsIdempotent() {
        fixture.properties.getEnrichment().setInitialDelay(Duration.ofHours(1));
        StatsEnrichmentScheduler delayed = new StatsEnrichmentScheduler(fixture.pNodeService,
                fixture.nodeStatsService, fixture.properties, fixture.clock);
        try {
            delayed.start();
            delayed.start();
            assertTrue(delayed.isStarted());
            assertEquals(0, delayed.getRunCount());
        } finally {
            delayed.stop();
        }
        assertFalse(delayed.isStarted());
    }

    @Test
    void testPartition() {
        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)),
                StatsEnrichmentScheduler.partition(List.of(1, 2, 3, 4, 5), 2));
        assertTrue(StatsEnrichmentScheduler.partition(List.of(), 15).isEmpty());
    }
}
