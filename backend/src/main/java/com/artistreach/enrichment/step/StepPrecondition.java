package com.artistreach.enrichment.step;

import com.artistreach.enrichment.model.ArtistProfile;

import java.util.Optional;

@FunctionalInterface
public interface StepPrecondition {
    StepPrecondition ALWAYS = (profile, context) -> Optional.empty();

    /**
     * Empty when the step can run, otherwise the reason it is skipped.
     */
    Optional<String> unmetReason(ArtistProfile profile, StepContext context);
}
