package com.artistreach.enrichment.model;

public record VideoChannel(
    String channelId,
    String title,
    String description,
    String customUrl,
    long subscriberCount,
    long videoCount,
    long viewCount,
    String country
) {
    public String canonicalUrl() {
        if (customUrl != null && !customUrl.isBlank()) {
            return "https://www.youtube.com/" + customUrl;
        }
        return "https://www.youtube.com/channel/" + channelId;
    }
}
