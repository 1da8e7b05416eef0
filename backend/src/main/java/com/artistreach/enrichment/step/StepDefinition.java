package com.artistreach.enrichment.step;

import com.artistreach.enrichment.model.DiscoveryMethod;

public record StepDefinition(
    DiscoveryMethod method,
    String label,
    StepPrecondition precondition,
    StepHandler handler
) {}
