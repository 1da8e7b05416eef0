package com.artistreach.enrichment.model;

public record RejectedEmail(String email, String reason, String source) {
    public RejectedEmail withSource(String stepSource) {
        return new RejectedEmail(email, reason, stepSource);
    }
}
