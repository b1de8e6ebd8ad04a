package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.config.PNodeProperties;
import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.client.FailureClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Keeps per-node stats warm in the cache, independently of inbound requests.
 * <p>
 * Every period the online nodes are fetched in fixed-size batches with a pause between
 * batches. At most one run is active: a tick that fires while a run is still going is
 * skipped, not queued. Stopping abandons the current run; cache writes are idempotent so
 * an abandoned run only leaves fewer entries warm.
 */
@Service
public class StatsEnrichmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(StatsEnrichmentScheduler.class);

    private final PNodeService pNodeService;
    private final NodeStatsService nodeStatsService;
    private final Clock clock;
    private final Duration period;
    private final Duration initialDelay;
    private final int batchSize;
    private final Duration batchPause;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runCount = new AtomicLong(0);
    private final AtomicLong skippedTicks = new AtomicLong(0);

    private volatile ScheduledExecutorService scheduler;
    private volatile Disposable currentRun;
    private volatile EnrichmentReport lastReport;

    public StatsEnrichmentScheduler(PNodeService pNodeService,
                                    NodeStatsService nodeStatsService,
                                    PNodeProperties properties,
                                    Clock clock) {
        this.pNodeService = pNodeService;
        this.nodeStatsService = nodeStatsService;
        this.clock = clock;
        PNodeProperties.EnrichmentProperties enrichment = properties.getEnrichment();
        this.period = enrichment.getPeriod();
        this.initialDelay = enrichment.getInitialDelay();
        this.batchSize = Math.max(1, enrichment.getBatchSize());
        this.batchPause = enrichment.getBatchPause();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("StatsEnrichmentScheduler already started");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stats-enrichment");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::tick, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("StatsEnrichmentScheduler started: period {} s, batch size {}, batch pause {} ms",
                period.toSeconds(), batchSize, batchPause.toMillis());
    }

    @PreDestroy
    public void stop() {
        started.set(false);
        ScheduledExecutorService executor = scheduler;
        if (executor != null) {
            executor.shutdownNow();
            scheduler = null;
        }
        Disposable run = currentRun;
        if (run != null && !run.isDisposed()) {
            run.dispose();
            log.info("Abandoned in-progress enrichment run on shutdown");
        }
        log.info("StatsEnrichmentScheduler stopped.");
    }

    /**
     * One timer tick. Starts a run unless one is already active.
     *
     * @return true if a run was started, false if the tick was skipped
     */
    public boolean tick() {
        if (!running.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            log.info("Previous enrichment run still in progress, skipping this tick (skipped so far: {})", skipped);
            return false;
        }
        runCount.incrementAndGet();
        try {
            currentRun = runOnce()
                    .doFinally(signal -> running.set(false))
                    .subscribe(report -> lastReport = report,
                            e -> log.error("Enrichment run terminated unexpectedly", e));
        } catch (RuntimeException e) {
            running.set(false);
            log.error("Could not start enrichment run", e);
        }
        return true;
    }

    /**
     * A complete enrichment pass. Per-node failures are counted in the report and never
     * fail the returned publisher.
     */
    public Mono<EnrichmentReport> runOnce() {
        long startedAt = clock.millis();
        return pNodeService.getAllNodes()
                .flatMap(nodes -> {
                    List<PNode> online = nodes.stream().filter(PNode::isOnline).collect(Collectors.toList());
                    List<List<PNode>> batches = partition(online, batchSize);
                    log.info("Enrichment run: {} online of {} nodes, {} batches", online.size(), nodes.size(), batches.size());
                    return Flux.fromIterable(batches)
                            .index()
                            .concatMap(indexed -> pauseBefore(indexed.getT1()).thenMany(processBatch(indexed.getT2())))
                            .collectList()
                            .map(outcomes -> report(startedAt, online.size(), batches.size(), outcomes));
                })
                .doOnNext(report -> log.info("Enrichment run finished in {} ms: {} succeeded, {} failed",
                        report.getDurationMillis(), report.getSucceeded(), report.getFailed()))
                .onErrorResume(e -> {
                    log.error("Enrichment run failed before processing nodes", e);
                    return Mono.just(report(startedAt, 0, 0, List.of()));
                });
    }

    private Mono<Void> pauseBefore(long batchIndex) {
        if (batchIndex == 0 || batchPause.isZero()) {
            return Mono.empty();
        }
        return Mono.delay(batchPause).then();
    }

    private Flux<NodeOutcome> processBatch(List<PNode> batch) {
        return Flux.fromIterable(batch)
                .flatMap(node -> nodeStatsService.fetchAndCache(node)
                        .map(stats -> NodeOutcome.success(node.getPubkey()))
                        .defaultIfEmpty(NodeOutcome.failure(node.getPubkey(), "empty stats"))
                        .onErrorResume(e -> {
                            nodeStatsService.logFailure(node, e);
                            String reason = FailureClassifier.isTransient(e) ? "unreachable" : e.getClass().getSimpleName();
                            return Mono.just(NodeOutcome.failure(node.getPubkey(), reason));
                        }));
    }

    private EnrichmentReport report(long startedAt, int online, int batches, List<NodeOutcome> outcomes) {
        Map<String, String> failures = new LinkedHashMap<>();
        int succeeded = 0;
        for (NodeOutcome outcome : outcomes) {
            if (outcome.failureReason == null) {
                succeeded++;
            } else {
                failures.put(outcome.pubkey, outcome.failureReason);
            }
        }
        return new EnrichmentReport(startedAt, clock.millis() - startedAt, online, batches,
                succeeded, failures.size(), failures);
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return batches;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStarted() {
        return started.get();
    }

    public long getRunCount() {
        return runCount.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public EnrichmentReport getLastReport() {
        return lastReport;
    }

    private static final class NodeOutcome {
        private final String pubkey;
        private final String failureReason;

        private NodeOutcome(String pubkey, String failureReason) {
            this.pubkey = pubkey;
            this.failureReason = failureReason;
        }

        static NodeOutcome success(String pubkey) {
            return new NodeOutcome(pubkey, null);
        }

        static NodeOutcome failure(String pubkey, String reason) {
            return new NodeOutcome(pubkey, reason);
        }
    }
}
