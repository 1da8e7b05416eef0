package com.artistreach.enrichment.fetch;

public class RenderingException extends RuntimeException {
    private final String reasonCode;

    public RenderingException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public RenderingException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
