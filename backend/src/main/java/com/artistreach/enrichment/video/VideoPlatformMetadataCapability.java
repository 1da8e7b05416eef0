package com.artistreach.enrichment.video;

import com.artistreach.enrichment.model.VideoChannel;
import com.artistreach.enrichment.model.VideoChannelCandidate;

import java.util.List;
import java.util.Optional;

public interface VideoPlatformMetadataCapability {
    boolean isAvailable();

    List<VideoChannelCandidate> search(String query, int maxResults);

    Optional<VideoChannel> getDetails(String channelId);

    /**
     * Channel id for a channel URL in any of its forms ({@code /channel/UC...}, {@code /@handle},
     * {@code /c/name}, {@code /user/name}).
     */
    Optional<String> resolveChannelId(String channelUrl);
}
