package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.ExtractionRequest;
import com.artistreach.enrichment.fetch.ApifyRenderingClient;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.model.StepOutcome;
import org.springframework.stereotype.Component;

/**
 * Reads the channel's about page, where artists often list a booking address that the API
 * description omits.
 */
@Component
public class VideoProfilePageStepHandler implements StepHandler {
    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public VideoProfilePageStepHandler(EmailExtractionService extractionService, EnrichmentProperties properties) {
        this.extractionService = extractionService;
        this.properties = properties;
    }

    static String channelUrl(ArtistProfile profile, StepContext context) {
        if (context.resolvedVideoChannelUrl() != null) {
            return context.resolvedVideoChannelUrl();
        }
        return profile.links().videoChannelUrl();
    }

    static String aboutUrl(String channelUrl) {
        String trimmed = channelUrl.endsWith("/") ? channelUrl.substring(0, channelUrl.length() - 1) : channelUrl;
        return trimmed.endsWith("/about") ? trimmed : trimmed + "/about";
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        String url = aboutUrl(channelUrl(profile, context));
        FetchOutcome fetch = context.capabilities().contentFetch().fetch(url, PlatformHint.VIDEO_PROFILE, true);
        if (fetch == null || !fetch.isUsable()) {
            return StepOutcome.builder()
                .fetch(fetch)
                .urlFetched(url)
                .failureReason(fetch == null ? null : fetch.diagnostic())
                .build();
        }
        EnrichmentProperties.Confidence weights = properties.getConfidence();
        ExtractionRequest request = ExtractionRequest.builder(fetch.content())
            .structured(ApifyRenderingClient.FIELD_BUSINESS_EMAIL, fetch.field(ApifyRenderingClient.FIELD_BUSINESS_EMAIL), weights.getStructuredField())
            .structured(ApifyRenderingClient.FIELD_EMAIL, fetch.field(ApifyRenderingClient.FIELD_EMAIL), weights.getStructuredSecondaryField())
            .pattern(weights.getPlatformRegex())
            .generative(weights.getGenerative(), profile.name())
            .build();
        ExtractionResult extraction = extractionService.extract(request, context.capabilities().generative());
        return StepOutcome.builder()
            .fetch(fetch)
            .extraction(extraction)
            .build();
    }
}
