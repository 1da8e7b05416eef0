package com.artistreach.enrichment.normalize;

import com.artistreach.enrichment.model.ArtistLinks;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.PlatformKind;
import com.artistreach.enrichment.model.RawArtistRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArtistProfileNormalizerTest {
    private final ArtistProfileNormalizer normalizer = new ArtistProfileNormalizer();

    @Test
    void readsKnownAliases() {
        ArtistProfile profile = normalizer.normalize(record(Map.of(
            "youtube_url", "youtube.com/@nightjar",
            "instagram_handle", "@nightjar",
            "website", "nightjarband.com",
            "linktree", "linktr.ee/nightjar"
        )));

        assertThat(profile.links()).isEqualTo(new ArtistLinks(
            "https://youtube.com/@nightjar",
            "nightjar",
            "https://nightjarband.com",
            "https://linktr.ee/nightjar"
        ));
    }

    @Test
    void aggregatorInWebsiteSlotIsMoved() {
        ArtistProfile profile = normalizer.normalize(record(Map.of("website", "https://linktr.ee/nightjar")));

        assertThat(profile.links().websiteUrl()).isNull();
        assertThat(profile.links().linkAggregatorUrl()).isEqualTo("https://linktr.ee/nightjar");
    }

    @Test
    void streamingProfileInWebsiteSlotIsDropped() {
        ArtistProfile profile = normalizer.normalize(record(Map.of("homepage", "https://open.spotify.com/artist/123")));

        assertThat(profile.links().hasWebsite()).isFalse();
    }

    @Test
    void unknownKeysAreClassifiedByHost() {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("Social_1", "https://www.instagram.com/nightjar/");
        links.put("other", "https://www.youtube.com/channel/UC123");
        links.put("merch", "https://nightjar.bandcamp.com");

        ArtistProfile profile = normalizer.normalize(record(links));

        assertThat(profile.links().photoHandle()).isEqualTo("nightjar");
        assertThat(profile.links().videoChannelUrl()).isEqualTo("https://www.youtube.com/channel/UC123");
        assertThat(profile.links().hasWebsite()).isFalse();
    }

    @Test
    void invalidHandleIsDiscarded() {
        ArtistProfile profile = normalizer.normalize(record(Map.of("instagram", "not a handle!")));

        assertThat(profile.links().hasPhotoHandle()).isFalse();
    }

    @Test
    void missingLinksAndPaddedNameAreTolerated() {
        RawArtistRecord raw = new RawArtistRecord("a-2", "  Nightjar  ", null, "Bio", "GB", null, null, null);

        ArtistProfile profile = normalizer.normalize(raw);

        assertThat(profile.name()).isEqualTo("Nightjar");
        assertThat(profile.links()).isEqualTo(ArtistLinks.NONE);
        assertThat(profile.genres()).isEmpty();
    }

    @Test
    void classifierRecognisesPlatformFamilies() {
        assertThat(LinkClassifier.classify("https://youtu.be/abc")).isEqualTo(PlatformKind.VIDEO);
        assertThat(LinkClassifier.classify("beacons.ai/nightjar")).isEqualTo(PlatformKind.LINK_AGGREGATOR);
        assertThat(LinkClassifier.classify("https://www.tiktok.com/@nightjar")).isEqualTo(PlatformKind.OTHER);
        assertThat(LinkClassifier.classify("https://nightjarband.com")).isEqualTo(PlatformKind.WEBSITE);
        assertThat(LinkClassifier.isTicketing("https://www.ticketmaster.com/nightjar")).isTrue();
        assertThat(LinkClassifier.hostOf("https://WWW.NightjarBand.com/contact")).isEqualTo("nightjarband.com");
    }

    private static RawArtistRecord record(Map<String, String> links) {
        return new RawArtistRecord("a-1", "Nightjar", links, null, "GB", List.of("indie"), 5000L, 120000L);
    }
}
