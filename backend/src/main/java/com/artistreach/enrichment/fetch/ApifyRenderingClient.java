package com.artistreach.enrichment.fetch;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.http.PoliteHttpClient;
import com.artistreach.enrichment.http.RunDeadlineContext;
import com.artistreach.enrichment.model.HttpFetchResult;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rendering jobs on Apify: start an actor run, poll it until it finishes, then read its default
 * dataset. The ceiling covers the whole cycle; a breach is reported once and never retried here.
 */
public class ApifyRenderingClient implements ManagedRenderingCapability {
    private static final Logger log = LoggerFactory.getLogger(ApifyRenderingClient.class);

    public static final String FIELD_BUSINESS_EMAIL = "businessEmail";
    public static final String FIELD_EMAIL = "email";
    public static final String FIELD_EXTERNAL_URL = "externalUrl";
    public static final String FIELD_BIOGRAPHY = "biography";
    public static final String FIELD_DESCRIPTION = "description";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final EnrichmentProperties.Rendering settings;

    public ApifyRenderingClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, EnrichmentProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getRendering();
    }

    @Override
    public boolean isAvailable() {
        return settings.isConfigured();
    }

    @Override
    public List<RenderedPage> render(RenderRequest request) {
        if (!isAvailable()) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_UNAVAILABLE, "rendering token not configured");
        }
        String actor = actorFor(request.jobType());
        Instant started = Instant.now();
        Duration ceiling = RunDeadlineContext.cap(Duration.ofSeconds(settings.getMaxWaitSeconds()));
        Instant giveUpAt = started.plus(ceiling);

        JsonNode run = startRun(actor, buildInput(request));
        String runId = run.path("id").asText(null);
        String datasetId = run.path("defaultDatasetId").asText(null);
        if (runId == null || datasetId == null) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, "actor run response missing ids");
        }
        log.debug("Started {} run {} for {}", actor, runId, request.url());

        waitForRun(runId, giveUpAt);
        List<RenderedPage> pages = readDataset(datasetId, request);
        log.info(
            "Rendered {} via {} in {} ms ({} items)",
            request.url(),
            actor,
            Duration.between(started, Instant.now()).toMillis(),
            pages.size()
        );
        return pages;
    }

    String actorFor(RenderJobType jobType) {
        return switch (jobType) {
            case VIDEO_PROFILE -> settings.getVideoProfileActor();
            case PHOTO_PROFILE -> settings.getPhotoProfileActor();
            case WEB_PAGE -> settings.getWebPageActor();
        };
    }

    ObjectNode buildInput(RenderRequest request) {
        ObjectNode input = objectMapper.createObjectNode();
        switch (request.jobType()) {
            case VIDEO_PROFILE -> {
                input.set("startUrls", startUrls(aboutPageUrl(request.url())));
                input.put("maxItems", 1);
            }
            case PHOTO_PROFILE -> {
                ArrayNode usernames = input.putArray("usernames");
                usernames.add(photoHandle(request.url()));
                input.put("resultsLimit", 1);
            }
            case WEB_PAGE -> {
                input.set("startUrls", startUrls(request.url()));
                input.put("maxCrawlPages", request.maxPages());
                input.put("crawlerType", "cheerio");
                input.put("maxCrawlDepth", request.maxPages() > 1 ? 1 : 0);
            }
        }
        return input;
    }

    private ArrayNode startUrls(String url) {
        ArrayNode startUrls = objectMapper.createArrayNode();
        startUrls.addObject().put("url", url);
        return startUrls;
    }

    private JsonNode startRun(String actor, ObjectNode input) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, "could not encode actor input", e);
        }
        String url = settings.getBaseUrl() + "/acts/" + actor + "/runs?token=" + encode(settings.getToken());
        HttpFetchResult response = httpClient.postJson(url, payload, Map.of());
        return readData(response, "start " + actor);
    }

    private void waitForRun(String runId, Instant giveUpAt) {
        String url = settings.getBaseUrl() + "/actor-runs/" + runId + "?token=" + encode(settings.getToken());
        int polls = 0;
        while (true) {
            if (!Instant.now().plusMillis(settings.getPollIntervalMs()).isBefore(giveUpAt)) {
                throw new RenderingException(
                    ReasonCodeClassifier.RENDERING_TIMEOUT,
                    "run " + runId + " still running after " + polls + " polls"
                );
            }
            sleep(settings.getPollIntervalMs());
            RunDeadlineContext.checkDeadline();
            polls++;
            JsonNode data = readData(httpClient.get(url, PoliteHttpClient.JSON_ACCEPT), "poll run");
            String status = data.path("status").asText("").toUpperCase(Locale.ROOT);
            log.debug("Run {} poll #{} status={}", runId, polls, status);
            switch (status) {
                case "SUCCEEDED":
                    return;
                case "FAILED":
                case "ABORTED":
                case "TIMED-OUT":
                    throw new RenderingException(
                        ReasonCodeClassifier.RENDERING_FAILED,
                        "run " + status + ": " + data.path("statusMessage").asText("unknown error")
                    );
                default:
                    break;
            }
        }
    }

    private List<RenderedPage> readDataset(String datasetId, RenderRequest request) {
        String url = settings.getBaseUrl() + "/datasets/" + datasetId + "/items?token="
            + encode(settings.getToken()) + "&format=json";
        HttpFetchResult response = httpClient.get(url, PoliteHttpClient.JSON_ACCEPT);
        JsonNode items = parse(response, "read dataset");
        if (!items.isArray() || items.isEmpty()) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, "no results returned");
        }
        List<RenderedPage> pages = new ArrayList<>();
        for (JsonNode item : items) {
            pages.add(toPage(item, request));
        }
        return pages;
    }

    RenderedPage toPage(JsonNode item, RenderRequest request) {
        String pageUrl = firstNonBlank(text(item, "url"), request.url());
        Map<String, String> fields = new LinkedHashMap<>();
        StringBuilder content = new StringBuilder();
        switch (request.jobType()) {
            case PHOTO_PROFILE -> {
                putIfPresent(fields, FIELD_BUSINESS_EMAIL, firstNonBlank(text(item, "businessEmail"), text(item, "business_email")));
                putIfPresent(fields, FIELD_EMAIL, firstNonBlank(text(item, "publicEmail"), text(item, "email")));
                putIfPresent(fields, FIELD_EXTERNAL_URL, text(item, "externalUrl"));
                putIfPresent(fields, FIELD_BIOGRAPHY, firstNonBlank(text(item, "biography"), text(item, "bio")));
                append(content, text(item, "fullName"));
                append(content, fields.get(FIELD_BIOGRAPHY));
                append(content, fields.get(FIELD_EXTERNAL_URL));
                append(content, text(item, "businessCategoryName"));
            }
            case VIDEO_PROFILE -> {
                putIfPresent(fields, FIELD_BUSINESS_EMAIL, text(item, "businessEmail"));
                putIfPresent(fields, FIELD_EMAIL, text(item, "email"));
                String description = firstNonBlank(text(item, "channelDescription"), text(item, "description"));
                putIfPresent(fields, FIELD_DESCRIPTION, description);
                append(content, description);
                append(content, text(item, "aboutText"));
                append(content, text(item, "contactInfo"));
                JsonNode links = item.path("channelDescriptionLinks");
                for (JsonNode link : links) {
                    append(content, link.isTextual() ? link.asText() : text(link, "url"));
                }
            }
            case WEB_PAGE -> append(content, firstNonBlank(text(item, "html"), text(item, "text"), text(item, "markdown")));
        }
        return new RenderedPage(pageUrl, content.length() == 0 ? null : content.toString(), fields);
    }

    private JsonNode readData(HttpFetchResult response, String action) {
        JsonNode root = parse(response, action);
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, action + ": response without data");
        }
        return data;
    }

    private JsonNode parse(HttpFetchResult response, String action) {
        if (response == null || !response.isSuccessful() || !response.hasBody()) {
            String key = response == null ? "no_response" : response.failureKey();
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, action + " failed: " + key);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, action + ": invalid JSON", e);
        }
    }

    static String aboutPageUrl(String channelUrl) {
        String trimmed = channelUrl.endsWith("/") ? channelUrl.substring(0, channelUrl.length() - 1) : channelUrl;
        return trimmed.endsWith("/about") ? trimmed : trimmed + "/about";
    }

    static String photoHandle(String profileUrl) {
        try {
            String path = URI.create(profileUrl.trim()).getPath();
            if (path != null) {
                for (String segment : path.split("/")) {
                    if (!segment.isBlank()) {
                        return segment.replace("@", "");
                    }
                }
            }
        } catch (IllegalArgumentException ignored) {
            // treat the value as a bare handle
        }
        return profileUrl.trim().replace("@", "");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderingException(ReasonCodeClassifier.RENDERING_FAILED, "interrupted while polling", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static void append(StringBuilder content, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        if (content.length() > 0) {
            content.append("\n\n");
        }
        content.append(value);
    }

    private static void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(name, value.trim());
        }
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText().trim();
        }
        return null;
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
