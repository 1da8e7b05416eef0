package com.artistreach.enrichment.model;

public enum PlatformHint {
    VIDEO_PROFILE,
    PHOTO_PROFILE,
    LINK_AGGREGATOR,
    WEBSITE
}
