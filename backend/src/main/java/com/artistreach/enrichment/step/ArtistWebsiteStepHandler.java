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

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Homepage plus a handful of contact, booking and about pages from the same site.
 */
@Component
public class ArtistWebsiteStepHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(ArtistWebsiteStepHandler.class);
    private static final List<String> CONVENTIONAL_PATHS = List.of("/contact", "/booking", "/about");

    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public ArtistWebsiteStepHandler(EmailExtractionService extractionService, EnrichmentProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        String url = profile.links().websiteUrl();
        FetchOutcome home = context.capabilities().contentFetch().fetch(url, PlatformHint.WEBSITE, true);
        if (home == null || !home.hasContent()) {
            return StepOutcome.builder()
                .fetch(home)
                .urlFetched(url)
                .failureReason(home == null ? null : home.diagnostic())
                .build();
        }

        StringBuilder content = new StringBuilder(home.content());
        EnrichmentProperties.Fetch fetchSettings = properties.getFetch();
        int fetched = 0;
        for (String subpage : subpages(home, fetchSettings.getMaxSubpages())) {
            StepPacing.pause(fetchSettings.getSubpageDelayMs());
            FetchOutcome page = context.capabilities().contentFetch().fetch(subpage, PlatformHint.WEBSITE, false);
            if (page != null && page.hasContent()) {
                content.append("\n\n").append(page.content());
                fetched++;
            }
        }
        log.debug("Website {} for {}: homepage plus {} sub-pages", url, profile.name(), fetched);

        EnrichmentProperties.Confidence weights = properties.getConfidence();
        ExtractionResult extraction = extractionService.extract(
            ExtractionRequest.builder(content.toString())
                .pattern(weights.getWebsiteRegex())
                .generative(weights.getGenerative(), profile.name())
                .build(),
            context.capabilities().generative()
        );
        return StepOutcome.builder()
            .fetch(home)
            .extraction(extraction)
            .build();
    }

    static List<String> subpages(FetchOutcome home, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> pages = new LinkedHashSet<>(ContactLinkFinder.find(
            home.content(),
            home.url(),
            ContactLinkFinder.WEBSITE_KEYWORDS,
            true,
            limit
        ));
        String origin = origin(home.url());
        if (origin != null) {
            for (String path : CONVENTIONAL_PATHS) {
                pages.add(origin + path);
            }
        }
        pages.remove(home.url());
        List<String> ordered = new ArrayList<>(pages);
        return ordered.size() <= limit ? ordered : ordered.subList(0, limit);
    }

    private static String origin(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
