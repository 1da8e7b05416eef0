package com.artistreach.enrichment.model;

import java.util.Map;

/**
 * Content retrieved for one URL. {@code structuredFields} holds values a platform-specialised
 * rendering job returned as named fields (for example a declared business email); they are
 * trusted without a verbatim check.
 */
public record FetchOutcome(
    String url,
    String content,
    FetchTier tierUsed,
    boolean wasBlocked,
    String diagnostic,
    Map<String, String> structuredFields
) {
    public FetchOutcome {
        structuredFields = structuredFields == null ? Map.of() : Map.copyOf(structuredFields);
    }

    public static FetchOutcome failed(String url, FetchTier tierUsed, boolean wasBlocked, String diagnostic) {
        return new FetchOutcome(url, null, tierUsed, wasBlocked, diagnostic, Map.of());
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public boolean isUsable() {
        return hasContent() || !structuredFields.isEmpty();
    }

    public int contentLength() {
        return content == null ? 0 : content.length();
    }

    public String field(String name) {
        String value = structuredFields.get(name);
        return value == null || value.isBlank() ? null : value;
    }
}
