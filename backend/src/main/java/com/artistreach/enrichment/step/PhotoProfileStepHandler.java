package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.ExtractionRequest;
import com.artistreach.enrichment.fetch.ApifyRenderingClient;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.AuxiliaryFields;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.normalize.LinkClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Photo profile: declared business email, then the biography, then everything else on the profile.
 * The profile's external link is handed to the link-in-bio step.
 */
@Component
public class PhotoProfileStepHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(PhotoProfileStepHandler.class);

    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public PhotoProfileStepHandler(EmailExtractionService extractionService, EnrichmentProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        String url = profile.links().photoProfileUrl();
        FetchOutcome fetch = context.capabilities().contentFetch().fetch(url, PlatformHint.PHOTO_PROFILE, true);
        if (fetch == null || !fetch.isUsable()) {
            return StepOutcome.builder()
                .fetch(fetch)
                .urlFetched(url)
                .failureReason(fetch == null ? null : fetch.diagnostic())
                .build();
        }

        StepOutcome.Builder outcome = StepOutcome.builder().fetch(fetch);
        String externalUrl = fetch.field(ApifyRenderingClient.FIELD_EXTERNAL_URL);
        if (externalUrl != null && !LinkClassifier.isTicketing(externalUrl)) {
            context.setResolvedLinkInBioUrl(LinkClassifier.withScheme(externalUrl));
            outcome.resolvedData(true);
            if (!LinkClassifier.isAggregator(externalUrl) && !profile.links().hasWebsite()) {
                outcome.auxiliary(new AuxiliaryFields(LinkClassifier.withScheme(externalUrl), null, null));
            }
            log.debug("Photo profile for {} links out to {}", profile.name(), externalUrl);
        }

        EnrichmentProperties.Confidence weights = properties.getConfidence();
        String biography = fetch.field(ApifyRenderingClient.FIELD_BIOGRAPHY);
        ExtractionResult declared = extractionService.extract(
            ExtractionRequest.builder(biography)
                .structured(ApifyRenderingClient.FIELD_BUSINESS_EMAIL, fetch.field(ApifyRenderingClient.FIELD_BUSINESS_EMAIL), weights.getStructuredField())
                .structured(ApifyRenderingClient.FIELD_EMAIL, fetch.field(ApifyRenderingClient.FIELD_EMAIL), weights.getStructuredSecondaryField())
                .pattern(weights.getPlatformBioRegex())
                .build(),
            context.capabilities().generative()
        );
        if (declared.found()) {
            return outcome.extraction(declared).build();
        }
        outcome.rejected(declared.rejected());

        ExtractionResult fullText = extractionService.extract(
            ExtractionRequest.builder(fetch.content())
                .pattern(weights.getPlatformTextRegex())
                .build(),
            context.capabilities().generative()
        );
        return outcome.extraction(fullText).build();
    }
}
