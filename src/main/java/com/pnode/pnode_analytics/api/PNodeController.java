package com.pnode.pnode_analytics.api;

import com.pnode.pnode_analytics.api.model.ErrorResponse;
import com.pnode.pnode_analytics.core.model.MapNode;
import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.service.MapService;
import com.pnode.pnode_analytics.service.NodeStatsService;
import com.pnode.pnode_analytics.service.PNodeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

@RestController
@RequestMapping("/pnodes")
public class PNodeController {
    private static final Logger log = LoggerFactory.getLogger(PNodeController.class);

    private final PNodeService pNodeService;
    private final NodeStatsService nodeStatsService;
    private final MapService mapService;

    public PNodeController(PNodeService pNodeService, NodeStatsService nodeStatsService, MapService mapService) {
        this.pNodeService = pNodeService;
        this.nodeStatsService = nodeStatsService;
        this.mapService = mapService;
    }

    @GetMapping
    public Mono<List<PNode>> getAll() {
        return pNodeService.getAllNodes()
                .doOnNext(nodes -> log.debug("/pnodes: {} nodes, {} with resource stats",
                        nodes.size(), nodes.stream().filter(PNode::hasResourceStats).count()));
    }

    // Declared before /{pubkey}; a map failure yields an empty list so map views keep rendering
    @GetMapping("/map")
    public Mono<List<MapNode>> getMap() {
        return mapService.getMapNodes()
                .onErrorResume(e -> {
                    log.warn("Map nodes unavailable: {}", e.toString());
                    return Mono.just(Collections.emptyList());
                });
    }

    @GetMapping("/{pubkey}")
    public Mono<ResponseEntity<Object>> getByPubkey(@PathVariable String pubkey) {
        return pNodeService.getNodeByPubkey(pubkey)
                .map(node -> ResponseEntity.ok().<Object>body(node))
                .defaultIfEmpty(new ResponseEntity<>(
                        ErrorResponse.notFound("pNode with pubkey " + pubkey + " not found"), HttpStatus.NOT_FOUND));
    }

    @GetMapping("/{pubkey}/stats")
    public Mono<ResponseEntity<Object>> getStats(@PathVariable String pubkey) {
        return nodeStatsService.getNodeStats(pubkey)
                .map(stats -> ResponseEntity.ok().<Object>body(stats))
                .defaultIfEmpty(new ResponseEntity<>(
                        ErrorResponse.notFound("Stats for pNode with pubkey " + pubkey + " not found or unavailable"),
                        HttpStatus.NOT_FOUND));
    }
}
