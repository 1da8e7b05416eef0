package com.artistreach.enrichment.model;

public enum PlatformKind {
    VIDEO,
    PHOTO,
    WEBSITE,
    LINK_AGGREGATOR,
    OTHER
}
