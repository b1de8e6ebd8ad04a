package com.pnode.pnode_analytics.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one stats enrichment run.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class EnrichmentReport {
    private long startedAtMillis;
    private long durationMillis;
    private int onlineNodes;
    private int batches;
    private int succeeded;
    private int failed;
    // pubkey -> short failure reason
    private Map<String, String> failures;
}
