package com.artistreach.enrichment.service;

import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.fetch.ContentFetchCapability;
import com.artistreach.enrichment.video.VideoPlatformMetadataCapability;

/**
 * The external capabilities a run may use. Content fetching and the FAST generative tier are
 * mandatory; the video metadata service and the DEEP tier only enable their steps.
 */
public record EnrichmentCapabilities(
    ContentFetchCapability contentFetch,
    VideoPlatformMetadataCapability videoMetadata,
    GenerativeExtractionCapability generative
) {
    public void validate() {
        if (contentFetch == null) {
            throw new EnrichmentConfigurationException("content fetch capability is not configured");
        }
        if (generative == null || !generative.isAvailable(GenerativeTier.FAST)) {
            throw new EnrichmentConfigurationException("FAST generative tier is not configured");
        }
    }

    public boolean hasVideoMetadata() {
        return videoMetadata != null && videoMetadata.isAvailable();
    }

    public boolean hasGenerative(GenerativeTier tier) {
        return generative != null && generative.isAvailable(tier);
    }
}
