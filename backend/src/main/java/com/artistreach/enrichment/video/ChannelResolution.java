package com.artistreach.enrichment.video;

import com.artistreach.enrichment.model.VideoChannel;

public record ChannelResolution(VideoChannel channel, double confidence, Method method, int candidatesConsidered) {
    public enum Method {
        KNOWN_URL,
        EXACT_NAME,
        MODEL_VERDICT,
        FUZZY_NAME
    }

    public String channelUrl() {
        return channel.canonicalUrl();
    }
}
