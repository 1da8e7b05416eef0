package com.artistreach.enrichment.step;

import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.model.DiscoveryMethod;
import com.artistreach.enrichment.normalize.LinkClassifier;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Discovery methods in priority order. The controller walks the rows top to bottom and stops at the
 * first one that yields an accepted email.
 */
@Component
public class DiscoveryStepTable {
    private final List<StepDefinition> rows;

    @Autowired
    public DiscoveryStepTable(
        VideoChannelMetadataStepHandler videoChannelMetadata,
        VideoProfilePageStepHandler videoProfilePage,
        PhotoProfileStepHandler photoProfile,
        LinkInBioStepHandler linkInBio,
        ArtistWebsiteStepHandler artistWebsite,
        ArtistBioStepHandler artistBio,
        WebSearchStepHandler webSearch
    ) {
        this.rows = List.of(
            row(DiscoveryMethod.VIDEO_CHANNEL_METADATA, (profile, context) ->
                context.capabilities().hasVideoMetadata()
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.CAPABILITY_UNCONFIGURED), videoChannelMetadata),
            row(DiscoveryMethod.VIDEO_PROFILE_PAGE, (profile, context) ->
                VideoProfilePageStepHandler.channelUrl(profile, context) != null
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.NO_VIDEO_CHANNEL), videoProfilePage),
            row(DiscoveryMethod.PHOTO_PROFILE, (profile, context) ->
                profile.links().hasPhotoHandle()
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.NO_PHOTO_HANDLE), photoProfile),
            row(DiscoveryMethod.LINK_IN_BIO, (profile, context) ->
                LinkInBioStepHandler.linkInBioUrl(profile, context) != null
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.NO_LINK_AGGREGATOR), linkInBio),
            row(DiscoveryMethod.ARTIST_WEBSITE, (profile, context) -> {
                if (!profile.links().hasWebsite()) {
                    return Optional.of(ReasonCodeClassifier.NO_WEBSITE);
                }
                if (LinkClassifier.isAggregator(profile.links().websiteUrl())) {
                    return Optional.of(ReasonCodeClassifier.WEBSITE_IS_AGGREGATOR);
                }
                if (LinkClassifier.isTicketing(profile.links().websiteUrl())) {
                    return Optional.of(ReasonCodeClassifier.TICKETING_PLATFORM);
                }
                return Optional.empty();
            }, artistWebsite),
            row(DiscoveryMethod.ARTIST_BIO, (profile, context) ->
                profile.hasBiography()
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.NO_BIOGRAPHY), artistBio),
            row(DiscoveryMethod.WEB_SEARCH_DEEP_DIVE, (profile, context) ->
                context.capabilities().hasGenerative(GenerativeTier.DEEP)
                    ? Optional.empty()
                    : Optional.of(ReasonCodeClassifier.CAPABILITY_UNCONFIGURED), webSearch)
        );
    }

    public DiscoveryStepTable(List<StepDefinition> rows) {
        this.rows = List.copyOf(rows);
    }

    public List<StepDefinition> rows() {
        return rows;
    }

    private static StepDefinition row(DiscoveryMethod method, StepPrecondition precondition, StepHandler handler) {
        return new StepDefinition(method, method.label(), precondition, handler);
    }
}
