package com.artistreach.enrichment.video;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.ChannelVerdict;
import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.model.ArtistLinks;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.VideoChannel;
import com.artistreach.enrichment.model.VideoChannelCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VideoChannelResolverTest {
    private VideoPlatformMetadataCapability video;
    private GenerativeExtractionCapability generative;
    private VideoChannelResolver resolver;

    @BeforeEach
    void setUp() {
        video = Mockito.mock(VideoPlatformMetadataCapability.class);
        generative = Mockito.mock(GenerativeExtractionCapability.class);
        when(generative.isAvailable(GenerativeTier.FAST)).thenReturn(true);
        resolver = new VideoChannelResolver(new EnrichmentProperties());
    }

    @Test
    void knownChannelUrlIsTrustedFully() {
        ArtistProfile profile = profile(new ArtistLinks("https://www.youtube.com/@nightjar", null, null, null));
        VideoChannel channel = channel("UCnightjar", "Nightjar", "Official channel", 40);
        when(video.resolveChannelId("https://www.youtube.com/@nightjar")).thenReturn(Optional.of("UCnightjar"));
        when(video.getDetails("UCnightjar")).thenReturn(Optional.of(channel));

        ChannelResolution resolution = resolver.resolve(profile, video, generative).orElseThrow();

        assertThat(resolution.method()).isEqualTo(ChannelResolution.Method.KNOWN_URL);
        assertThat(resolution.confidence()).isEqualTo(1.0);
        verify(video, never()).search(anyString(), anyInt());
    }

    @Test
    void singleExactNameWithMusicSignalsSkipsTheModel() {
        when(video.search(eq("Nightjar music artist"), anyInt()))
            .thenReturn(List.of(new VideoChannelCandidate("UC1", "Nightjar", "")));
        when(video.getDetails("UC1")).thenReturn(Optional.of(channel("UC1", "Nightjar", "Official music videos", 12)));

        ChannelResolution resolution = resolver.resolve(profile(ArtistLinks.NONE), video, generative).orElseThrow();

        assertThat(resolution.method()).isEqualTo(ChannelResolution.Method.EXACT_NAME);
        assertThat(resolution.confidence()).isEqualTo(0.95);
        verify(generative, never()).complete(any(), anyString(), any());
    }

    @Test
    void modelVerdictPicksAmongSeveralCandidates() {
        when(video.search(anyString(), anyInt())).thenReturn(List.of(
            new VideoChannelCandidate("UC1", "Nightjar Bird Sounds", ""),
            new VideoChannelCandidate("UC2", "NIGHTJAR", "")
        ));
        when(video.getDetails("UC1")).thenReturn(Optional.of(channel("UC1", "Nightjar Bird Sounds", "Birdsong at dusk", 300)));
        when(video.getDetails("UC2")).thenReturn(Optional.of(channel("UC2", "NIGHTJAR", "Leeds band", 48)));
        when(generative.complete(eq(GenerativeTier.FAST), anyString(), eq(ChannelVerdict.class)))
            .thenReturn(new ChannelVerdict("UC2", 0.8, "band from Leeds"));

        ChannelResolution resolution = resolver.resolve(profile(ArtistLinks.NONE), video, generative).orElseThrow();

        assertThat(resolution.method()).isEqualTo(ChannelResolution.Method.MODEL_VERDICT);
        assertThat(resolution.channel().channelId()).isEqualTo("UC2");
        assertThat(resolution.candidatesConsidered()).isEqualTo(2);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generative).complete(eq(GenerativeTier.FAST), prompt.capture(), eq(ChannelVerdict.class));
        assertThat(prompt.getValue()).contains("Name: \"Nightjar\"").contains("Channel ID: UC2").contains("Country: GB");
    }

    @Test
    void lowConfidenceVerdictFallsBackToFuzzyName() {
        when(video.search(anyString(), anyInt())).thenReturn(List.of(
            new VideoChannelCandidate("UC1", "Nightjar - Topic", ""),
            new VideoChannelCandidate("UC2", "Other", "")
        ));
        when(video.getDetails("UC1")).thenReturn(Optional.of(channel("UC1", "Nightjar - Topic", "", 10)));
        when(video.getDetails("UC2")).thenReturn(Optional.of(channel("UC2", "Other", "", 10)));
        when(generative.complete(eq(GenerativeTier.FAST), anyString(), eq(ChannelVerdict.class)))
            .thenReturn(new ChannelVerdict("UC1", 0.3, "unsure"));

        ChannelResolution resolution = resolver.resolve(profile(ArtistLinks.NONE), video, generative).orElseThrow();

        assertThat(resolution.method()).isEqualTo(ChannelResolution.Method.FUZZY_NAME);
        assertThat(resolution.confidence()).isEqualTo(0.6);
    }

    @Test
    void unverifiableCandidatesResolveNothing() {
        when(video.search(anyString(), anyInt())).thenReturn(List.of(
            new VideoChannelCandidate("UC1", "Birdwatching Weekly", ""),
            new VideoChannelCandidate("UC2", "Dusk Recordings", "")
        ));
        when(video.getDetails("UC1")).thenReturn(Optional.of(channel("UC1", "Birdwatching Weekly", "", 5)));
        when(video.getDetails("UC2")).thenReturn(Optional.of(channel("UC2", "Dusk Recordings", "", 5)));
        when(generative.complete(eq(GenerativeTier.FAST), anyString(), eq(ChannelVerdict.class)))
            .thenReturn(new ChannelVerdict("UC9", 0.9, "hallucinated id"));

        assertThat(resolver.resolve(profile(ArtistLinks.NONE), video, generative)).isEmpty();
    }

    @Test
    void emptySearchResolvesNothing() {
        when(video.search(anyString(), anyInt())).thenReturn(List.of());

        assertThat(resolver.resolve(profile(ArtistLinks.NONE), video, generative)).isEmpty();
    }

    @Test
    void nameMatchingHelpers() {
        VideoChannel channel = channel("UC1", "  nightjar ", "", 0);

        assertThat(VideoChannelResolver.isExactName(channel, "Nightjar")).isTrue();
        assertThat(VideoChannelResolver.hasMusicSignals(channel)).isFalse();
        assertThat(VideoChannelResolver.isFuzzyName(channel("UC2", "Nightjar Official", "", 0), "Night-jar")).isTrue();
    }

    private static ArtistProfile profile(ArtistLinks links) {
        return new ArtistProfile("a-1", "Nightjar", links, null, "GB", List.of("indie rock"), 5000L, 120000L);
    }

    private static VideoChannel channel(String id, String title, String description, long videos) {
        return new VideoChannel(id, title, description, "", 1000L, videos, 50000L, "GB");
    }
}
