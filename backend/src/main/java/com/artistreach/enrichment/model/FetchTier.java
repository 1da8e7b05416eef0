package com.artistreach.enrichment.model;

public enum FetchTier {
    NONE,
    DIRECT,
    RENDERED
}
