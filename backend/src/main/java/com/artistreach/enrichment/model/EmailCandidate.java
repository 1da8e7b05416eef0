package com.artistreach.enrichment.model;

public record EmailCandidate(
    String email,
    String source,
    double confidence,
    ExtractionPath origin
) {
    public EmailCandidate withSource(String stepSource) {
        return new EmailCandidate(email, stepSource, confidence, origin);
    }
}
