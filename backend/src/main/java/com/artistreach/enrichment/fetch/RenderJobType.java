package com.artistreach.enrichment.fetch;

import com.artistreach.enrichment.model.PlatformHint;

public enum RenderJobType {
    VIDEO_PROFILE,
    PHOTO_PROFILE,
    WEB_PAGE;

    public static RenderJobType forHint(PlatformHint hint) {
        if (hint == null) {
            return WEB_PAGE;
        }
        return switch (hint) {
            case VIDEO_PROFILE -> VIDEO_PROFILE;
            case PHOTO_PROFILE -> PHOTO_PROFILE;
            case LINK_AGGREGATOR, WEBSITE -> WEB_PAGE;
        };
    }
}
