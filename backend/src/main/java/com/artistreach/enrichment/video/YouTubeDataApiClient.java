package com.artistreach.enrichment.video;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.http.PoliteHttpClient;
import com.artistreach.enrichment.model.HttpFetchResult;
import com.artistreach.enrichment.model.VideoChannel;
import com.artistreach.enrichment.model.VideoChannelCandidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube Data API v3 client. A search costs 100 quota units and a channel lookup 1, so lookups by
 * id are preferred whenever the URL already carries one.
 */
public class YouTubeDataApiClient implements VideoPlatformMetadataCapability {
    private static final Logger log = LoggerFactory.getLogger(YouTubeDataApiClient.class);

    private static final Pattern CHANNEL_ID_URL = Pattern.compile("youtube\\.com/channel/(UC[a-zA-Z0-9_-]+)");
    private static final Pattern HANDLE_URL =
        Pattern.compile("youtube\\.com/(@[a-zA-Z0-9._-]+|c/[a-zA-Z0-9._-]+|user/[a-zA-Z0-9._-]+)");

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final EnrichmentProperties.Video settings;

    public YouTubeDataApiClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, EnrichmentProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getVideo();
    }

    @Override
    public boolean isAvailable() {
        return settings.isConfigured();
    }

    @Override
    public List<VideoChannelCandidate> search(String query, int maxResults) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String url = settings.getBaseUrl() + "/search?part=snippet&type=channel"
            + "&q=" + encode(query.trim())
            + "&maxResults=" + Math.max(1, maxResults)
            + "&key=" + encode(settings.getApiKey());
        JsonNode root = getJson(url, "search");
        if (root == null) {
            return List.of();
        }
        List<VideoChannelCandidate> results = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String channelId = firstNonBlank(
                item.path("snippet").path("channelId").asText(null),
                item.path("id").path("channelId").asText(null)
            );
            if (channelId == null) {
                continue;
            }
            results.add(new VideoChannelCandidate(
                channelId,
                item.path("snippet").path("title").asText(""),
                item.path("snippet").path("description").asText("")
            ));
        }
        return results;
    }

    @Override
    public Optional<VideoChannel> getDetails(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return Optional.empty();
        }
        String url = settings.getBaseUrl() + "/channels?part=snippet,statistics,brandingSettings"
            + "&id=" + encode(channelId)
            + "&key=" + encode(settings.getApiKey());
        JsonNode root = getJson(url, "channels");
        if (root == null) {
            return Optional.empty();
        }
        JsonNode item = root.path("items").path(0);
        if (item.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode snippet = item.path("snippet");
        JsonNode statistics = item.path("statistics");
        return Optional.of(new VideoChannel(
            item.path("id").asText(channelId),
            snippet.path("title").asText(""),
            snippet.path("description").asText(""),
            snippet.path("customUrl").asText(""),
            parseCount(statistics.path("subscriberCount")),
            parseCount(statistics.path("videoCount")),
            parseCount(statistics.path("viewCount")),
            snippet.path("country").asText("")
        ));
    }

    @Override
    public Optional<String> resolveChannelId(String channelUrl) {
        if (channelUrl == null || channelUrl.isBlank()) {
            return Optional.empty();
        }
        Matcher direct = CHANNEL_ID_URL.matcher(channelUrl);
        if (direct.find()) {
            return Optional.of(direct.group(1));
        }
        Matcher handle = HANDLE_URL.matcher(channelUrl);
        String query;
        if (handle.find()) {
            String value = handle.group(1);
            query = value.startsWith("@") ? value.substring(1) : value.replaceFirst("^(c|user)/", "");
        } else {
            query = channelUrl.replaceFirst("https?://(www\\.)?youtube\\.com/?", "").replace('/', ' ').trim();
        }
        if (query.isBlank()) {
            return Optional.empty();
        }
        List<VideoChannelCandidate> found = search(query, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0).channelId());
    }

    private JsonNode getJson(String url, String endpoint) {
        HttpFetchResult response = httpClient.get(url, PoliteHttpClient.JSON_ACCEPT);
        if (response == null || !response.isSuccessful() || !response.hasBody()) {
            log.warn("YouTube {} request failed: {}", endpoint, response == null ? "no_response" : response.failureKey());
            return null;
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.warn("YouTube {} returned invalid JSON", endpoint, e);
            return null;
        }
    }

    private static long parseCount(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0L;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText("0").trim());
        } catch (NumberFormatException ignored) {
            return 0L;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
