package com.artistreach.enrichment.model;

public record VideoChannelCandidate(String channelId, String title, String description) {}
