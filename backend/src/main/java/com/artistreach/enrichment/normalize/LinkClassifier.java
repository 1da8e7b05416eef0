package com.artistreach.enrichment.normalize;

import com.artistreach.enrichment.model.PlatformKind;

import java.net.URI;
import java.util.List;
import java.util.Locale;

public final class LinkClassifier {
    public static final List<String> AGGREGATOR_DOMAINS = List.of(
        "linktr.ee", "beacons.ai", "stan.store", "lnk.to", "solo.to", "linkin.bio", "lnk.bio", "bio.link"
    );

    public static final List<String> TICKETING_DOMAINS = List.of(
        "ticketmaster.com", "eventbrite.com", "bandsintown.com", "songkick.com", "seetickets.com",
        "dice.fm", "axs.com", "livenation.com", "residentadvisor.net", "ra.co"
    );

    private static final List<String> VIDEO_DOMAINS = List.of("youtube.com", "youtu.be");
    private static final List<String> PHOTO_DOMAINS = List.of("instagram.com", "instagr.am");
    private static final List<String> SOCIAL_DOMAINS = List.of(
        "facebook.com", "twitter.com", "x.com", "tiktok.com", "spotify.com", "soundcloud.com",
        "music.apple.com", "bandcamp.com", "threads.net"
    );

    private LinkClassifier() {}

    public static PlatformKind classify(String url) {
        String host = hostOf(url);
        if (host == null) {
            return PlatformKind.OTHER;
        }
        if (matches(host, VIDEO_DOMAINS)) {
            return PlatformKind.VIDEO;
        }
        if (matches(host, PHOTO_DOMAINS)) {
            return PlatformKind.PHOTO;
        }
        if (matches(host, AGGREGATOR_DOMAINS)) {
            return PlatformKind.LINK_AGGREGATOR;
        }
        if (matches(host, SOCIAL_DOMAINS)) {
            return PlatformKind.OTHER;
        }
        return PlatformKind.WEBSITE;
    }

    public static boolean isAggregator(String url) {
        String host = hostOf(url);
        return host != null && matches(host, AGGREGATOR_DOMAINS);
    }

    public static boolean isTicketing(String url) {
        String host = hostOf(url);
        return host != null && matches(host, TICKETING_DOMAINS);
    }

    public static String withScheme(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        return "https://" + value;
    }

    public static String hostOf(String url) {
        String value = withScheme(url);
        if (value == null) {
            return null;
        }
        try {
            String host = URI.create(value).getHost();
            if (host == null || !host.contains(".")) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean matches(String host, List<String> domains) {
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
