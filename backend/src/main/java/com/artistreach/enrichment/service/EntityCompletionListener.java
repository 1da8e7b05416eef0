package com.artistreach.enrichment.service;

import com.artistreach.enrichment.model.EnrichmentResult;

@FunctionalInterface
public interface EntityCompletionListener {
    EntityCompletionListener NONE = (result, index, total) -> {
    };

    void onEntityComplete(EnrichmentResult result, int index, int total);
}
