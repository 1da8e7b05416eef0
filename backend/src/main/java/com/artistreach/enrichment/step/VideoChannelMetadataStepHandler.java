package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.ExtractionRequest;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.service.EnrichmentCapabilities;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import com.artistreach.enrichment.video.ChannelResolution;
import com.artistreach.enrichment.video.VideoChannelResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class VideoChannelMetadataStepHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(VideoChannelMetadataStepHandler.class);

    private final VideoChannelResolver channelResolver;
    private final EmailExtractionService extractionService;
    private final EnrichmentProperties properties;

    public VideoChannelMetadataStepHandler(
        VideoChannelResolver channelResolver,
        EmailExtractionService extractionService,
        EnrichmentProperties properties
    ) {
        this.channelResolver = channelResolver;
        this.extractionService = extractionService;
        this.properties = properties;
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        EnrichmentCapabilities capabilities = context.capabilities();
        Optional<ChannelResolution> resolution =
            channelResolver.resolve(profile, capabilities.videoMetadata(), capabilities.generative());
        if (resolution.isEmpty()) {
            return StepOutcome.failure(profile.links().videoChannelUrl(), ReasonCodeClassifier.CHANNEL_NOT_RESOLVED);
        }
        ChannelResolution resolved = resolution.get();
        String channelUrl = resolved.channelUrl();
        context.setResolvedVideoChannelUrl(channelUrl);
        log.info(
            "Resolved channel {} for {} via {} ({})",
            channelUrl,
            profile.name(),
            resolved.method(),
            resolved.confidence()
        );

        EnrichmentProperties.Confidence weights = properties.getConfidence();
        ExtractionRequest request = ExtractionRequest.builder(resolved.channel().description())
            .pattern(weights.getPlatformRegex())
            .generative(weights.getGenerative(), profile.name())
            .build();
        ExtractionResult extraction = extractionService.extract(request, capabilities.generative());
        return StepOutcome.builder()
            .extraction(extraction)
            .rawContent(extraction.rawContentUsed())
            .urlFetched(channelUrl)
            .resolvedData(true)
            .build();
    }
}
