package com.artistreach.enrichment.fetch;

import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.PlatformHint;

public interface ContentFetchCapability {
    /**
     * Never throws for transport problems; failures come back as an outcome without content and a
     * diagnostic.
     */
    default FetchOutcome fetch(String url, PlatformHint hint) {
        return fetch(url, hint, true);
    }

    /**
     * @param allowRendering false for follow-up pages (sub-pages, contact links) that are only worth a
     *     direct request
     */
    FetchOutcome fetch(String url, PlatformHint hint, boolean allowRendering);
}
