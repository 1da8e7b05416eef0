package com.artistreach.enrichment.fetch;

public record RenderRequest(String url, RenderJobType jobType, int maxPages) {
    public RenderRequest {
        maxPages = Math.max(1, maxPages);
    }
}
