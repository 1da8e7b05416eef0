package com.artistreach.enrichment.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChannelVerdict(
    @JsonProperty("channelId") String channelId,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning
) {
    public boolean names(String candidateId) {
        return channelId != null && channelId.equals(candidateId);
    }
}
