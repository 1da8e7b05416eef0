package com.artistreach.enrichment.model;

public enum ExtractionPath {
    STRUCTURED_FIELD,
    PATTERN_SCAN,
    GENERATIVE,
    WEB_SEARCH;

    public boolean isTrustedField() {
        return this == STRUCTURED_FIELD;
    }
}
