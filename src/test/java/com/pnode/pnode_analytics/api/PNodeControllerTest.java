package com.pnode.pnode_analytics.api;

import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.model.GeoLocation;
import com.pnode.pnode_analytics.service.AnalyticsService;
import com.pnode.pnode_analytics.service.GeoService;
import com.pnode.pnode_analytics.service.MapService;
import com.pnode.pnode_analytics.support.ServiceFixture;
import com.pnode.pnode_analytics.support.TestPods;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Arrays;

public class PNodeControllerTest {

    private ServiceFixture fixture;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        fixture.properties.getGeo().setBaseUrl("http://127.0.0.1:1");
        fixture.gossip(Arrays.asList(
                TestPods.onlinePod("ON", "10.0.0.1:9001", fixture.clock),
                TestPods.offlinePod("OFF", "10.0.0.2:9001", fixture.clock)));

        AnalyticsService analyticsService = new AnalyticsService(fixture.cache, fixture.pNodeService, fixture.statusResolver);
        GeoService geoService = new GeoService(fixture.cache, WebClient.builder(), fixture.properties);
        MapService mapService = new MapService(fixture.pNodeService, analyticsService, geoService, fixture.properties);
        PNodeController controller = new PNodeController(fixture.pNodeService, fixture.nodeStatsService, mapService);

        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testListsAllNodes() {
        client.get().uri("/pnodes")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].pubkey").isEqualTo("ON")
                .jsonPath("$[0].status").isEqualTo("online")
                .jsonPath("$[1].status").isEqualTo("offline");
    }

    @Test
    void testSingleNode() {
        client.get().uri("/pnodes/ON")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ip").isEqualTo("10.0.0.1");
    }

    @Test
    void testUnknownNodeIsNotFound() {
        client.get().uri("/pnodes/nobody")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Not found");
    }

    @Test
    void testStatsOfOfflineNodeAreNotFound() {
        client.get().uri("/pnodes/OFF/stats")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testStatsOfOnlineNode() {
        fixture.clientFactory.client("10.0.0.1").stats(() -> Mono.just(TestPods.stats(64, 128)));

        client.get().uri("/pnodes/ON/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ram_total").isEqualTo(128);
    }

    @Test
    void testMapOnlyContainsLocatedNodes() {
        fixture.cache.set(CacheKeys.geo("10.0.0.1"),
                new GeoLocation(48.1, 11.6, "Germany", "Bavaria", "Munich"), CacheTtl.GEO).block();

        client.get().uri("/pnodes/map")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].pubkey").isEqualTo("ON")
                .jsonPath("$[0].country").isEqualTo("Germany");
    }
}
