package com.artistreach.enrichment.model;

import java.util.List;

/**
 * Outcome of a batch. {@code total} counts the artists actually enriched, which is fewer than
 * requested when the batch thread was interrupted.
 */
public record BatchSummary(
    List<EnrichmentResult> results,
    int total,
    int found,
    double hitRate,
    boolean interrupted
) {
    public BatchSummary(List<EnrichmentResult> results, int total, int found, double hitRate) {
        this(results, total, found, hitRate, false);
    }
}
