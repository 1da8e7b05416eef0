package com.artistreach.enrichment.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Schema every extraction reply must match. Fields are optional; unknown fields are a parse error.
 */
public record GenerativeReply(
    @JsonProperty("email") String email,
    @JsonProperty("source") String source,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("website") String website,
    @JsonProperty("management") String management,
    @JsonProperty("booking_agent") String bookingAgent
) {
    public static final GenerativeReply EMPTY = new GenerativeReply(null, null, null, null, null, null);

    public boolean hasEmail() {
        return email != null && !email.isBlank() && !"null".equalsIgnoreCase(email.trim());
    }
}
