package com.artistreach.enrichment.model;

import java.util.List;

public record ExtractionResult(
    List<EmailCandidate> candidates,
    double confidence,
    String rawContentUsed,
    ExtractionPath path,
    List<RejectedEmail> rejected
) {
    public ExtractionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static ExtractionResult none(String rawContentUsed, List<RejectedEmail> rejected) {
        return new ExtractionResult(List.of(), 0.0, rawContentUsed, null, rejected);
    }

    public boolean found() {
        return !candidates.isEmpty();
    }
}
