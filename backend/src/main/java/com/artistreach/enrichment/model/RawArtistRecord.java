package com.artistreach.enrichment.model;

import java.util.List;
import java.util.Map;

/**
 * Artist row as supplied by the caller, with the social links still keyed by whatever alias the
 * import used ({@code youtube}, {@code youtube_url}, {@code instagram_handle}, ...).
 */
public record RawArtistRecord(
    String id,
    String name,
    Map<String, String> socialLinks,
    String biography,
    String country,
    List<String> genres,
    Long followerCount,
    Long monthlyListeners
) {}
