package com.artistreach.enrichment.model;

public enum DiscoveryMethod {
    VIDEO_CHANNEL_METADATA("video_channel_metadata", "Video channel metadata"),
    VIDEO_PROFILE_PAGE("video_profile_page", "Video channel about page"),
    PHOTO_PROFILE("photo_profile", "Photo profile"),
    LINK_IN_BIO("link_in_bio", "Link-in-bio page"),
    ARTIST_WEBSITE("artist_website", "Artist website"),
    ARTIST_BIO("artist_bio", "Artist biography"),
    WEB_SEARCH_DEEP_DIVE("web_search_deep_dive", "Web search deep dive");

    private final String id;
    private final String label;

    DiscoveryMethod(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }
}
