package com.artistreach.enrichment.fetch;

import java.util.Map;

public record RenderedPage(String url, String text, Map<String, String> structuredFields) {
    public RenderedPage {
        structuredFields = structuredFields == null ? Map.of() : Map.copyOf(structuredFields);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
