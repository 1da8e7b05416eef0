package com.artistreach.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnrichmentPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserLikeDefault() {
        EnrichmentProperties properties = new EnrichmentProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        EnrichmentProperties properties = new EnrichmentProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
    }

    @Test
    void pipelineDefaultsMatchDocumentedValues() {
        EnrichmentProperties properties = new EnrichmentProperties();
        assertEquals(500, properties.getFetch().getMinContentChars());
        assertEquals(2000, properties.getRendering().getPollIntervalMs());
        assertEquals(45, properties.getRendering().getMaxWaitSeconds());
        assertEquals(240, properties.getPipeline().getEntityDeadlineSeconds());
        assertEquals(0.9, properties.getConfidence().getStructuredField());
        assertEquals(0.6, properties.getConfidence().getWebSearch());
    }

    @Test
    void modelTierNeedsKeyAndName() {
        EnrichmentProperties properties = new EnrichmentProperties();
        assertFalse(properties.getGenerative().getFast().isConfigured());
        properties.getGenerative().getFast().setApiKey("key");
        assertTrue(properties.getGenerative().getFast().isConfigured());
        properties.getGenerative().getFast().setModelName(" ");
        assertFalse(properties.getGenerative().getFast().isConfigured());
    }

    @Test
    void renderingAndVideoRequireCredentials() {
        EnrichmentProperties properties = new EnrichmentProperties();
        assertFalse(properties.getRendering().isConfigured());
        assertFalse(properties.getVideo().isConfigured());
        properties.getRendering().setToken("token");
        properties.getVideo().setApiKey("key");
        assertTrue(properties.getRendering().isConfigured());
        assertTrue(properties.getVideo().isConfigured());
    }
}
