package com.artistreach.enrichment.model;

import java.util.List;

public record ArtistProfile(
    String id,
    String name,
    ArtistLinks links,
    String biography,
    String country,
    List<String> genres,
    Long followerCount,
    Long monthlyListeners
) {
    public ArtistProfile {
        links = links == null ? ArtistLinks.NONE : links;
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    public boolean hasBiography() {
        return biography != null && !biography.isBlank();
    }
}
