package com.artistreach.enrichment.model;

import java.util.List;

public record FilterResult(List<String> accepted, List<RejectedEmail> rejected) {
    public FilterResult {
        accepted = accepted == null ? List.of() : List.copyOf(accepted);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public boolean hasAccepted() {
        return !accepted.isEmpty();
    }
}
