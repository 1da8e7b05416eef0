package com.artistreach.enrichment.step;

import com.artistreach.enrichment.service.EnrichmentCapabilities;

/**
 * Per-run state shared between steps: the capabilities in use and data an earlier step resolved for
 * a later one.
 */
public class StepContext {
    private final EnrichmentCapabilities capabilities;
    private String resolvedVideoChannelUrl;
    private String resolvedLinkInBioUrl;

    public StepContext(EnrichmentCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    public EnrichmentCapabilities capabilities() {
        return capabilities;
    }

    public String resolvedVideoChannelUrl() {
        return resolvedVideoChannelUrl;
    }

    public void setResolvedVideoChannelUrl(String resolvedVideoChannelUrl) {
        this.resolvedVideoChannelUrl = resolvedVideoChannelUrl;
    }

    public String resolvedLinkInBioUrl() {
        return resolvedLinkInBioUrl;
    }

    public void setResolvedLinkInBioUrl(String resolvedLinkInBioUrl) {
        this.resolvedLinkInBioUrl = resolvedLinkInBioUrl;
    }
}
