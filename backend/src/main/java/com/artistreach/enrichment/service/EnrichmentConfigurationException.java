package com.artistreach.enrichment.service;

public class EnrichmentConfigurationException extends RuntimeException {
    public EnrichmentConfigurationException(String message) {
        super(message);
    }
}
