package com.artistreach.enrichment.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Input for one extraction pass. Structured values come from named fields a platform returned and
 * are trusted as-is; everything else must be found in {@code content}.
 */
public record ExtractionRequest(
    String content,
    List<StructuredValue> structuredValues,
    double patternConfidence,
    boolean allowGenerative,
    double generativeConfidence,
    String artistName
) {
    public ExtractionRequest {
        structuredValues = structuredValues == null ? List.of() : List.copyOf(structuredValues);
    }

    public record StructuredValue(String field, String value, double confidence) {}

    public static Builder builder(String content) {
        return new Builder(content);
    }

    public static final class Builder {
        private final String content;
        private final List<StructuredValue> structuredValues = new ArrayList<>();
        private double patternConfidence;
        private boolean allowGenerative;
        private double generativeConfidence;
        private String artistName;

        private Builder(String content) {
            this.content = content;
        }

        public Builder structured(String field, String value, double confidence) {
            if (value != null && !value.isBlank()) {
                structuredValues.add(new StructuredValue(field, value.trim(), confidence));
            }
            return this;
        }

        public Builder pattern(double confidence) {
            this.patternConfidence = confidence;
            return this;
        }

        public Builder generative(double confidence, String artistName) {
            this.allowGenerative = true;
            this.generativeConfidence = confidence;
            this.artistName = artistName;
            return this;
        }

        public ExtractionRequest build() {
            return new ExtractionRequest(
                content,
                structuredValues,
                patternConfidence,
                allowGenerative,
                generativeConfidence,
                artistName
            );
        }
    }
}
