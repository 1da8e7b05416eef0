package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.ExtractionRequest;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.model.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LinkInBioStepHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(LinkInBioStepHandler.class);

    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public LinkInBioStepHandler(EmailExtractionService extractionService, EnrichmentProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    static String linkInBioUrl(ArtistProfile profile, StepContext context) {
        if (context.resolvedLinkInBioUrl() != null) {
            return context.resolvedLinkInBioUrl();
        }
        return profile.links().linkAggregatorUrl();
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        String url = linkInBioUrl(profile, context);
        FetchOutcome fetch = context.capabilities().contentFetch().fetch(url, PlatformHint.LINK_AGGREGATOR, true);
        if (fetch == null || !fetch.hasContent()) {
            return StepOutcome.builder()
                .fetch(fetch)
                .urlFetched(url)
                .failureReason(fetch == null ? null : fetch.diagnostic())
                .build();
        }

        StringBuilder content = new StringBuilder(fetch.content());
        EnrichmentProperties.Fetch fetchSettings = properties.getFetch();
        List<String> contactLinks = ContactLinkFinder.find(
            fetch.content(),
            fetch.url(),
            ContactLinkFinder.LINK_IN_BIO_KEYWORDS,
            false,
            fetchSettings.getMaxContactLinks()
        );
        for (String link : contactLinks) {
            StepPacing.pause(fetchSettings.getSubpageDelayMs());
            FetchOutcome page = context.capabilities().contentFetch().fetch(link, PlatformHint.WEBSITE, false);
            if (page != null && page.hasContent()) {
                content.append("\n\n").append(page.content());
            } else {
                log.debug("Contact link {} gave nothing: {}", link, page == null ? null : page.diagnostic());
            }
        }

        EnrichmentProperties.Confidence weights = properties.getConfidence();
        ExtractionResult extraction = extractionService.extract(
            ExtractionRequest.builder(content.toString())
                .pattern(weights.getAggregatorRegex())
                .generative(weights.getGenerative(), profile.name())
                .build(),
            context.capabilities().generative()
        );
        return StepOutcome.builder()
            .fetch(fetch)
            .extraction(extraction)
            .build();
    }
}
