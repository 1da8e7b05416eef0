package com.artistreach.enrichment.http;

public class RunDeadlineExceededException extends RuntimeException {
    public RunDeadlineExceededException(String message) {
        super(message);
    }
}
