package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.ExtractionRequest;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.StepOutcome;
import org.springframework.stereotype.Component;

@Component
public class ArtistBioStepHandler implements StepHandler {
    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public ArtistBioStepHandler(EmailExtractionService extractionService, EnrichmentProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        ExtractionResult extraction = extractionService.extract(
            ExtractionRequest.builder(profile.biography())
                .pattern(properties.getConfidence().getBiographyRegex())
                .build(),
            context.capabilities().generative()
        );
        return StepOutcome.builder()
            .extraction(extraction)
            .rawContent(profile.biography())
            .build();
    }
}
