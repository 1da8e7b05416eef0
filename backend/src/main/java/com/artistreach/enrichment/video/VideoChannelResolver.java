package com.artistreach.enrichment.video;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.ChannelVerdict;
import com.artistreach.enrichment.ai.ExtractionParseException;
import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.VideoChannel;
import com.artistreach.enrichment.model.VideoChannelCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the artist's own channel. A known channel URL is looked up directly; otherwise the platform
 * is searched by name and the candidates are verified before one is accepted.
 */
@Component
public class VideoChannelResolver {
    private static final Logger log = LoggerFactory.getLogger(VideoChannelResolver.class);

    static final double EXACT_MATCH_CONFIDENCE = 0.95;
    static final double FUZZY_MATCH_CONFIDENCE = 0.6;
    private static final List<String> MUSIC_SIGNALS = List.of("music", "artist", "booking", "spotify");

    static final String VERIFY_PROMPT = """
        You are verifying which YouTube channel belongs to a specific music artist.

        ARTIST INFO:
        - Name: "%s"
        - Country: %s
        - Genres: %s
        - Monthly listeners: %s

        YOUTUBE CHANNEL CANDIDATES:
        %s

        RULES:
        1. Match on name similarity, music content, audience size relative to the listener count, and \
        descriptions that mention the artist's other profiles or music.
        2. A channel with 100 subscribers is unlikely to belong to an artist with 1M monthly listeners.
        3. If no candidate is a good match, say so. Do not force a match.

        Reply with exactly one JSON object and nothing else:
        {"channelId": "<channel id or empty>", "confidence": <0.0-1.0>, "reasoning": "<brief explanation>"}""";

    private final EnrichmentProperties.Video settings;

    public VideoChannelResolver(EnrichmentProperties properties) {
        this.settings = properties.getVideo();
    }

    public Optional<ChannelResolution> resolve(
        ArtistProfile profile,
        VideoPlatformMetadataCapability video,
        GenerativeExtractionCapability generative
    ) {
        if (profile.links().hasVideoChannel()) {
            return video.resolveChannelId(profile.links().videoChannelUrl())
                .flatMap(video::getDetails)
                .map(channel -> new ChannelResolution(channel, 1.0, ChannelResolution.Method.KNOWN_URL, 1));
        }
        return discover(profile, video, generative);
    }

    Optional<ChannelResolution> discover(
        ArtistProfile profile,
        VideoPlatformMetadataCapability video,
        GenerativeExtractionCapability generative
    ) {
        String query = profile.name() + " music artist";
        List<VideoChannelCandidate> found = video.search(query, settings.getSearchResults());
        if (found.isEmpty()) {
            log.info("No video channels found for {}", profile.name());
            return Optional.empty();
        }
        List<VideoChannel> detailed = new ArrayList<>();
        for (VideoChannelCandidate candidate : found.subList(0, Math.min(found.size(), settings.getDetailCandidates()))) {
            video.getDetails(candidate.channelId()).ifPresent(detailed::add);
        }
        if (detailed.isEmpty()) {
            return Optional.empty();
        }

        VideoChannel top = detailed.get(0);
        if (detailed.size() == 1 && isExactName(top, profile.name()) && hasMusicSignals(top)) {
            return Optional.of(new ChannelResolution(top, EXACT_MATCH_CONFIDENCE, ChannelResolution.Method.EXACT_NAME, 1));
        }

        Optional<ChannelResolution> verified = verify(profile, detailed, generative);
        if (verified.isPresent()) {
            return verified;
        }
        if (isFuzzyName(top, profile.name())) {
            return Optional.of(new ChannelResolution(
                top,
                FUZZY_MATCH_CONFIDENCE,
                ChannelResolution.Method.FUZZY_NAME,
                detailed.size()
            ));
        }
        log.info("Could not verify any of {} channel candidates for {}", detailed.size(), profile.name());
        return Optional.empty();
    }

    private Optional<ChannelResolution> verify(
        ArtistProfile profile,
        List<VideoChannel> candidates,
        GenerativeExtractionCapability generative
    ) {
        if (generative == null || !generative.isAvailable(GenerativeTier.FAST)) {
            return Optional.empty();
        }
        ChannelVerdict verdict;
        try {
            verdict = generative.complete(GenerativeTier.FAST, buildPrompt(profile, candidates), ChannelVerdict.class);
        } catch (ExtractionParseException e) {
            log.warn("Unparseable channel verdict for {}: {}", profile.name(), e.getMessage());
            return Optional.empty();
        }
        if (verdict == null || verdict.confidence() < settings.getMinVerificationConfidence()) {
            return Optional.empty();
        }
        for (VideoChannel channel : candidates) {
            if (verdict.names(channel.channelId())) {
                log.debug("Channel {} verified for {}: {}", channel.channelId(), profile.name(), verdict.reasoning());
                return Optional.of(new ChannelResolution(
                    channel,
                    verdict.confidence(),
                    ChannelResolution.Method.MODEL_VERDICT,
                    candidates.size()
                ));
            }
        }
        return Optional.empty();
    }

    String buildPrompt(ArtistProfile profile, List<VideoChannel> candidates) {
        StringBuilder described = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            VideoChannel channel = candidates.get(i);
            String description = channel.description() == null ? "" : channel.description();
            if (description.length() > 500) {
                description = description.substring(0, 500);
            }
            if (i > 0) {
                described.append("\n\n");
            }
            described.append("Candidate ").append(i + 1).append(":\n")
                .append("  - Channel name: \"").append(channel.title()).append("\"\n")
                .append("  - Subscribers: ").append(channel.subscriberCount()).append('\n')
                .append("  - Videos: ").append(channel.videoCount()).append('\n')
                .append("  - Total views: ").append(channel.viewCount()).append('\n')
                .append("  - Country: ").append(blankToUnknown(channel.country())).append('\n')
                .append("  - Custom URL: ").append(blankToUnknown(channel.customUrl())).append('\n')
                .append("  - Description: ").append(description).append('\n')
                .append("  - Channel ID: ").append(channel.channelId());
        }
        return VERIFY_PROMPT.formatted(
            profile.name(),
            blankToUnknown(profile.country()),
            profile.genres().isEmpty() ? "unknown" : String.join(", ", profile.genres()),
            profile.monthlyListeners() == null ? "unknown" : profile.monthlyListeners().toString(),
            described
        );
    }

    static boolean isExactName(VideoChannel channel, String artistName) {
        return channel.title() != null
            && artistName != null
            && channel.title().trim().toLowerCase(Locale.ROOT).equals(artistName.trim().toLowerCase(Locale.ROOT));
    }

    static boolean hasMusicSignals(VideoChannel channel) {
        String description = channel.description() == null ? "" : channel.description().toLowerCase(Locale.ROOT);
        for (String signal : MUSIC_SIGNALS) {
            if (description.contains(signal)) {
                return true;
            }
        }
        return channel.videoCount() > 0;
    }

    static boolean isFuzzyName(VideoChannel channel, String artistName) {
        String title = squash(channel.title());
        String name = squash(artistName);
        if (title.isEmpty() || name.isEmpty()) {
            return false;
        }
        return title.contains(name) || name.contains(title);
    }

    private static String squash(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private static String blankToUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
