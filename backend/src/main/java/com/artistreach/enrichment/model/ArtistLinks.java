package com.artistreach.enrichment.model;

public record ArtistLinks(
    String videoChannelUrl,
    String photoHandle,
    String websiteUrl,
    String linkAggregatorUrl
) {
    public static final ArtistLinks NONE = new ArtistLinks(null, null, null, null);

    public boolean hasVideoChannel() {
        return hasText(videoChannelUrl);
    }

    public boolean hasPhotoHandle() {
        return hasText(photoHandle);
    }

    public boolean hasWebsite() {
        return hasText(websiteUrl);
    }

    public boolean hasLinkAggregator() {
        return hasText(linkAggregatorUrl);
    }

    public String photoProfileUrl() {
        return hasPhotoHandle() ? "https://www.instagram.com/" + photoHandle + "/" : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
