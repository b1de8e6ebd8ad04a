package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.model.NodeStatus;
import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.model.RawPod;
import com.pnode.pnode_analytics.support.ServiceFixture;
import com.pnode.pnode_analytics.support.TestPods;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class PNodeServiceTest {

    private ServiceFixture fixture;
    private PNodeService service;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        service = fixture.pNodeService;
        fixture.gossip(Arrays.asList(
                TestPods.onlinePod("A", "10.0.0.1:9001", fixture.clock),
                TestPods.offlinePod("B", "10.0.0.2:9001", fixture.clock),
                TestPods.onlinePod("A", "10.0.0.9:9001", fixture.clock)));
    }

    @Test
    void testDiscoveryResultIsDedupedAndCached() {
        List<PNode> nodes = service.getAllNodes().block();

        assertEquals(2, nodes.size());
        assertEquals("10.0.0.1:9001", nodes.get(0).getAddress());
        assertTrue(fixture.remote.contains(CacheKeys.NODE_SET));
        assertEquals(1, fixture.seed().podsWithStatsCalls.get());
    }

    @Test
    void testWarmNodeSetAvoidsDiscovery() {
        service.getAllNodes().block();
        fixture.clock.advance(Duration.ofSeconds(29));
        service.getAllNodes().block();

        assertEquals(1, fixture.seed().podsWithStatsCalls.get());
    }

    @Test
    void testExpiredNodeSetIsRediscovered() {
        service.getAllNodes().block();
        fixture.clock.advance(CacheTtl.NODE_SET.getDuration());
        service.getAllNodes().block();

        assertEquals(2, fixture.seed().podsWithStatsCalls.get());
    }

    @Test
    void testStatusIsRecomputedOnCachedRead() {
        fixture.gossip(List.of(TestPods.pod("C", "10.0.0.3:9001", fixture.clock, 290)));
        assertEquals(NodeStatus.ONLINE, service.getAllNodes().block().get(0).getStatus());

        fixture.clock.advance(Duration.ofSeconds(20));

        assertEquals(NodeStatus.OFFLINE, service.getAllNodes().block().get(0).getStatus());
        assertEquals(1, fixture.seed().podsWithStatsCalls.get(), "served from the cached node set");
    }

    @Test
    void testWarmStatsAreMergedIntoNodes() {
        fixture.cache.set(CacheKeys.nodeStats("A"), TestPods.stats(512, 2048), CacheTtl.NODE_STATS).block();

        List<PNode> nodes = service.getAllNodes().block();

        PNode a = nodes.get(0);
        assertTrue(a.hasResourceStats());
        assertEquals(512L, a.getRamUsed());
        assertEquals(2048L, a.getRamTotal());
        assertEquals("10.0.0.1:9001", a.getAddress(), "discovery fields are untouched");
        assertFalse(nodes.get(1).hasResourceStats());
    }

    @Test
    void testStatsOutliveNodeSet() {
        service.getAllNodes().block();
        fixture.cache.set(CacheKeys.nodeStats("A"), TestPods.stats(1, 2), CacheTtl.NODE_STATS).block();
        fixture.clock.advance(Duration.ofSeconds(60));

        PNode a = service.getAllNodes().block().get(0);

        assertEquals(2, fixture.seed().podsWithStatsCalls.get());
        assertEquals(1L, a.getRamUsed());
    }

    @Test
    void testGetNodeByPubkey() {
        StepVerifier.create(service.getNodeByPubkey("B"))
                .assertNext(node -> assertEquals("10.0.0.2", node.getIp()))
                .verifyComplete();
        StepVerifier.create(service.getNodeByPubkey("missing"))
                .verifyComplete();
    }

    @Test
    void testRefreshForcesRediscovery() {
        service.getAllNodes().block();
        service.refresh().block();

        assertEquals(2, fixture.seed().podsWithStatsCalls.get());
    }

    @Test
    void testNoSeedAnswerYieldsEmptyNodeSet() {
        fixture.seed().podsWithStats(() -> Mono.error(new ConnectException("refused")));

        StepVerifier.create(service.getAllNodes())
                .assertNext(nodes -> assertTrue(nodes.isEmpty()))
                .verifyComplete();
    }

    @Test
    void testConcurrentMissesShareOneDiscovery() {
        Sinks.One<List<RawPod>> answer = Sinks.one();
        fixture.seed().podsWithStats(answer::asMono);
        AtomicReference<List<PNode>> first = new AtomicReference<>();
        AtomicReference<List<PNode>> second = new AtomicReference<>();

        service.getAllNodes().subscribe(first::set);
        service.getAllNodes().subscribe(second::set);
        answer.tryEmitValue(List.of(TestPods.onlinePod("D", "10.0.0.4:9001", fixture.clock)));

        assertEquals(1, fixture.seed().podsWithStatsCalls.get());
        assertEquals(1, first.get().size());
        assertEquals(first.get(), second.get());
    }
}
