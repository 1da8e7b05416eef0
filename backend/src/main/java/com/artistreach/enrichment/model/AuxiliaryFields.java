package com.artistreach.enrichment.model;

public record AuxiliaryFields(String website, String management, String bookingAgent) {
    public static final AuxiliaryFields EMPTY = new AuxiliaryFields(null, null, null);

    public AuxiliaryFields {
        website = blankToNull(website);
        management = blankToNull(management);
        bookingAgent = blankToNull(bookingAgent);
    }

    public boolean isEmpty() {
        return website == null && management == null && bookingAgent == null;
    }

    /**
     * Values already present win; {@code later} only fills the gaps.
     */
    public AuxiliaryFields mergedWith(AuxiliaryFields later) {
        if (later == null || later.isEmpty()) {
            return this;
        }
        return new AuxiliaryFields(
            website != null ? website : later.website(),
            management != null ? management : later.management(),
            bookingAgent != null ? bookingAgent : later.bookingAgent()
        );
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
            return null;
        }
        return trimmed;
    }
}
