package com.artistreach.enrichment.normalize;

import com.artistreach.enrichment.model.ArtistLinks;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.PlatformKind;
import com.artistreach.enrichment.model.RawArtistRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps the loosely keyed social links of an imported artist row onto typed {@link ArtistLinks}.
 * Known aliases are read first; any remaining URL is classified by its host and fills an empty slot.
 */
@Component
public class ArtistProfileNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ArtistProfileNormalizer.class);

    private static final List<String> VIDEO_KEYS = List.of("youtube", "youtube_url", "youtube_channel", "youtube_channel_url");
    private static final List<String> PHOTO_KEYS = List.of("instagram", "instagram_url", "instagram_handle");
    private static final List<String> WEBSITE_KEYS = List.of("website", "website_url", "homepage", "official_website");
    private static final List<String> AGGREGATOR_KEYS = List.of("linktree", "linktree_url", "link_in_bio", "linkinbio");
    private static final Pattern HANDLE = Pattern.compile("^[A-Za-z0-9._]{1,30}$");

    public ArtistProfile normalize(RawArtistRecord raw) {
        Map<String, String> links = lowerKeys(raw.socialLinks());
        String video = first(links, VIDEO_KEYS);
        String photo = first(links, PHOTO_KEYS);
        String website = first(links, WEBSITE_KEYS);
        String aggregator = first(links, AGGREGATOR_KEYS);

        if (website != null) {
            PlatformKind kind = LinkClassifier.classify(website);
            if (kind == PlatformKind.LINK_AGGREGATOR) {
                aggregator = aggregator == null ? website : aggregator;
                website = null;
            } else if (kind == PlatformKind.VIDEO) {
                video = video == null ? website : video;
                website = null;
            } else if (kind == PlatformKind.PHOTO) {
                photo = photo == null ? website : photo;
                website = null;
            } else if (kind == PlatformKind.OTHER) {
                website = null;
            }
        }

        for (Map.Entry<String, String> entry : links.entrySet()) {
            if (isKnownKey(entry.getKey())) {
                continue;
            }
            String value = entry.getValue();
            switch (LinkClassifier.classify(value)) {
                case VIDEO -> video = video == null ? value : video;
                case PHOTO -> photo = photo == null ? value : photo;
                case LINK_AGGREGATOR -> aggregator = aggregator == null ? value : aggregator;
                default -> {
                }
            }
        }

        ArtistLinks typed = new ArtistLinks(
            LinkClassifier.withScheme(video),
            photoHandle(photo),
            LinkClassifier.withScheme(website),
            LinkClassifier.withScheme(aggregator)
        );
        log.debug("Normalized links for {}: {}", raw.name(), typed);
        return new ArtistProfile(
            raw.id(),
            raw.name() == null ? "" : raw.name().trim(),
            typed,
            raw.biography(),
            raw.country(),
            raw.genres(),
            raw.followerCount(),
            raw.monthlyListeners()
        );
    }

    static String photoHandle(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        if (candidate.contains("/")) {
            candidate = firstPathSegment(LinkClassifier.withScheme(candidate));
        }
        if (candidate == null) {
            return null;
        }
        candidate = candidate.startsWith("@") ? candidate.substring(1) : candidate;
        return HANDLE.matcher(candidate).matches() ? candidate : null;
    }

    private static String firstPathSegment(String url) {
        try {
            String path = URI.create(url).getPath();
            if (path == null) {
                return null;
            }
            for (String segment : path.split("/")) {
                if (!segment.isBlank()) {
                    return segment;
                }
            }
            return null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Map<String, String> lowerKeys(Map<String, String> socialLinks) {
        Map<String, String> out = new LinkedHashMap<>();
        if (socialLinks == null) {
            return out;
        }
        for (Map.Entry<String, String> entry : socialLinks.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            out.putIfAbsent(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue().trim());
        }
        return out;
    }

    private static String first(Map<String, String> links, List<String> keys) {
        for (String key : keys) {
            String value = links.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static boolean isKnownKey(String key) {
        return VIDEO_KEYS.contains(key) || PHOTO_KEYS.contains(key) || WEBSITE_KEYS.contains(key) || AGGREGATOR_KEYS.contains(key);
    }
}
