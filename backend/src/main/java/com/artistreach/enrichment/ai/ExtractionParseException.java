package com.artistreach.enrichment.ai;

public class ExtractionParseException extends RuntimeException {
    public ExtractionParseException(String message) {
        super(message);
    }

    public ExtractionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
