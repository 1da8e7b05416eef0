package com.artistreach.enrichment.step;

import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.StepOutcome;

public interface StepHandler {
    /**
     * Runs one discovery method. Candidates come back unfiltered by the final gate; the controller
     * applies it.
     */
    StepOutcome handle(ArtistProfile profile, StepContext context);
}
