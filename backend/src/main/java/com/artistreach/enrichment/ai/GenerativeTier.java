package com.artistreach.enrichment.ai;

public enum GenerativeTier {
    /** Classification and verbatim extraction over supplied content. */
    FAST,
    /** Web-search augmented; replies cite the page they read. */
    DEEP
}
