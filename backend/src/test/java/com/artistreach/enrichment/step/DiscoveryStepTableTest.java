package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.EmailPatternScanner;
import com.artistreach.enrichment.fetch.ContentFetchCapability;
import com.artistreach.enrichment.filter.EmailQualityFilter;
import com.artistreach.enrichment.model.ArtistLinks;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.DiscoveryMethod;
import com.artistreach.enrichment.model.EmailCandidate;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.service.EnrichmentCapabilities;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import com.artistreach.enrichment.video.VideoPlatformMetadataCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class DiscoveryStepTableTest {
    private DiscoveryStepTable table;
    private VideoPlatformMetadataCapability video;
    private GenerativeExtractionCapability generative;
    private StepContext context;

    @BeforeEach
    void setUp() {
        table = new DiscoveryStepTable(
            Mockito.mock(VideoChannelMetadataStepHandler.class),
            Mockito.mock(VideoProfilePageStepHandler.class),
            Mockito.mock(PhotoProfileStepHandler.class),
            Mockito.mock(LinkInBioStepHandler.class),
            Mockito.mock(ArtistWebsiteStepHandler.class),
            Mockito.mock(ArtistBioStepHandler.class),
            Mockito.mock(WebSearchStepHandler.class)
        );
        video = Mockito.mock(VideoPlatformMetadataCapability.class);
        generative = Mockito.mock(GenerativeExtractionCapability.class);
        context = new StepContext(new EnrichmentCapabilities(Mockito.mock(ContentFetchCapability.class), video, generative));
    }

    @Test
    void rowsFollowPriorityOrder() {
        assertThat(table.rows()).extracting(StepDefinition::method).containsExactly(
            DiscoveryMethod.VIDEO_CHANNEL_METADATA,
            DiscoveryMethod.VIDEO_PROFILE_PAGE,
            DiscoveryMethod.PHOTO_PROFILE,
            DiscoveryMethod.LINK_IN_BIO,
            DiscoveryMethod.ARTIST_WEBSITE,
            DiscoveryMethod.ARTIST_BIO,
            DiscoveryMethod.WEB_SEARCH_DEEP_DIVE
        );
        assertThat(table.rows().get(0).label()).isEqualTo("Video channel metadata");
    }

    @Test
    void bareProfileSkipsEveryStepWithItsReason() {
        ArtistProfile bare = new ArtistProfile("a-1", "Nightjar", null, " ", "GB", List.of(), null, null);

        List<Optional<String>> reasons = table.rows().stream()
            .map(row -> row.precondition().unmetReason(bare, context))
            .toList();

        assertThat(reasons).containsExactly(
            Optional.of(ReasonCodeClassifier.CAPABILITY_UNCONFIGURED),
            Optional.of(ReasonCodeClassifier.NO_VIDEO_CHANNEL),
            Optional.of(ReasonCodeClassifier.NO_PHOTO_HANDLE),
            Optional.of(ReasonCodeClassifier.NO_LINK_AGGREGATOR),
            Optional.of(ReasonCodeClassifier.NO_WEBSITE),
            Optional.of(ReasonCodeClassifier.NO_BIOGRAPHY),
            Optional.of(ReasonCodeClassifier.CAPABILITY_UNCONFIGURED)
        );
    }

    @Test
    void completeProfileRunsEveryStep() {
        when(video.isAvailable()).thenReturn(true);
        when(generative.isAvailable(GenerativeTier.DEEP)).thenReturn(true);
        ArtistProfile full = new ArtistProfile(
            "a-1",
            "Nightjar",
            new ArtistLinks("https://youtube.com/@nightjar", "nightjar", "https://nightjarband.com", "https://linktr.ee/nightjar"),
            "Leeds four-piece.",
            "GB",
            List.of("indie"),
            null,
            null
        );

        assertThat(table.rows()).allSatisfy(row -> assertThat(row.precondition().unmetReason(full, context)).isEmpty());
    }

    @Test
    void dataResolvedByEarlierStepsUnlocksLaterOnes() {
        ArtistProfile profile = new ArtistProfile("a-1", "Nightjar", null, null, "GB", List.of(), null, null);
        context.setResolvedVideoChannelUrl("https://www.youtube.com/@nightjar");
        context.setResolvedLinkInBioUrl("https://linktr.ee/nightjar");

        assertThat(row(DiscoveryMethod.VIDEO_PROFILE_PAGE).precondition().unmetReason(profile, context)).isEmpty();
        assertThat(row(DiscoveryMethod.LINK_IN_BIO).precondition().unmetReason(profile, context)).isEmpty();
    }

    @Test
    void websiteThatIsReallyAnAggregatorOrTicketingPageIsSkipped() {
        assertThat(websiteReason("https://linktr.ee/nightjar")).contains(ReasonCodeClassifier.WEBSITE_IS_AGGREGATOR);
        assertThat(websiteReason("https://www.songkick.com/artists/1-nightjar")).contains(ReasonCodeClassifier.TICKETING_PLATFORM);
    }

    @Test
    void biographyStepUsesThePatternScanOnly() {
        EnrichmentProperties properties = new EnrichmentProperties();
        ArtistBioStepHandler handler = new ArtistBioStepHandler(
            new EmailExtractionService(new EmailPatternScanner(), new EmailQualityFilter(properties), properties),
            properties
        );
        ArtistProfile profile = new ArtistProfile(
            "a-1", "Nightjar", null, "Leeds four-piece. Bookings: hello@nightjarband.com", "GB", List.of(), null, null
        );

        StepOutcome outcome = handler.handle(profile, context);

        assertThat(outcome.candidates()).extracting(EmailCandidate::email).containsExactly("hello@nightjarband.com");
        assertThat(outcome.candidates().get(0).confidence()).isEqualTo(0.7);
        assertThat(outcome.rawContent()).isEqualTo(profile.biography());
        Mockito.verifyNoInteractions(generative);
    }

    private Optional<String> websiteReason(String website) {
        ArtistProfile profile = new ArtistProfile("a-1", "Nightjar", new ArtistLinks(null, null, website, null), null, "GB", List.of(), null, null);
        return row(DiscoveryMethod.ARTIST_WEBSITE).precondition().unmetReason(profile, context);
    }

    private StepDefinition row(DiscoveryMethod method) {
        return table.rows().stream().filter(row -> row.method() == method).findFirst().orElseThrow();
    }
}
