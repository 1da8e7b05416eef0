package com.artistreach.enrichment.service;

import com.artistreach.enrichment.model.DiscoveryStep;

@FunctionalInterface
public interface EnrichmentProgressListener {
    EnrichmentProgressListener NONE = (step, index) -> {
    };

    /**
     * Called after every status change of {@code step}; {@code index} is its position in the run.
     */
    void onStepUpdate(DiscoveryStep step, int index);
}
