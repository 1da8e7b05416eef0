package com.artistreach.enrichment.fetch;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.http.PoliteHttpClient;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApifyRenderingClientTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private EnrichmentProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new EnrichmentProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getRendering().setBaseUrl(server.url("/v2").toString());
        properties.getRendering().setToken("test-token");
        properties.getRendering().setPollIntervalMs(10);
        properties.getRendering().setMaxWaitSeconds(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void photoProfileRunIsStartedPolledAndRead() throws Exception {
        server.enqueue(json("{\"data\": {\"id\": \"run-1\", \"defaultDatasetId\": \"ds-1\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"RUNNING\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"SUCCEEDED\"}}"));
        server.enqueue(json("""
            [{"username": "nightjar", "fullName": "Nightjar", "biography": "Leeds four-piece",
              "businessEmail": "booking@nightjarband.com", "externalUrl": "https://linktr.ee/nightjar"}]
            """));

        List<RenderedPage> pages = client().render(
            new RenderRequest("https://www.instagram.com/nightjar/", RenderJobType.PHOTO_PROFILE, 1)
        );

        assertThat(pages).singleElement().satisfies(page -> {
            assertThat(page.structuredFields())
                .containsEntry(ApifyRenderingClient.FIELD_BUSINESS_EMAIL, "booking@nightjarband.com")
                .containsEntry(ApifyRenderingClient.FIELD_EXTERNAL_URL, "https://linktr.ee/nightjar");
            assertThat(page.text()).contains("Leeds four-piece");
        });

        RecordedRequest start = server.takeRequest();
        assertThat(start.getMethod()).isEqualTo("POST");
        assertThat(start.getPath()).isEqualTo("/v2/acts/apify~instagram-profile-scraper/runs?token=test-token");
        JsonNode input = objectMapper.readTree(start.getBody().readUtf8());
        assertThat(input.path("usernames").get(0).asText()).isEqualTo("nightjar");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v2/actor-runs/run-1?token=test-token");
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v2/datasets/ds-1/items?token=test-token&format=json");
    }

    @Test
    void failedRunIsReported() {
        server.enqueue(json("{\"data\": {\"id\": \"run-2\", \"defaultDatasetId\": \"ds-2\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"FAILED\", \"statusMessage\": \"actor crashed\"}}"));

        assertThatThrownBy(() -> client().render(
            new RenderRequest("https://linktr.ee/nightjar", RenderJobType.WEB_PAGE, 3)
        ))
            .isInstanceOf(RenderingException.class)
            .hasMessageContaining("actor crashed")
            .extracting(e -> ((RenderingException) e).getReasonCode())
            .isEqualTo(ReasonCodeClassifier.RENDERING_FAILED);
    }

    @Test
    void runStillGoingAtCeilingTimesOut() {
        properties.getRendering().setMaxWaitSeconds(1);
        properties.getRendering().setPollIntervalMs(600);
        server.enqueue(json("{\"data\": {\"id\": \"run-3\", \"defaultDatasetId\": \"ds-3\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"RUNNING\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"RUNNING\"}}"));

        assertThatThrownBy(() -> client().render(
            new RenderRequest("https://www.youtube.com/@nightjar", RenderJobType.VIDEO_PROFILE, 1)
        ))
            .isInstanceOf(RenderingException.class)
            .extracting(e -> ((RenderingException) e).getReasonCode())
            .isEqualTo(ReasonCodeClassifier.RENDERING_TIMEOUT);
    }

    @Test
    void emptyDatasetIsAFailure() {
        server.enqueue(json("{\"data\": {\"id\": \"run-4\", \"defaultDatasetId\": \"ds-4\"}}"));
        server.enqueue(json("{\"data\": {\"status\": \"SUCCEEDED\"}}"));
        server.enqueue(json("[]"));

        assertThatThrownBy(() -> client().render(
            new RenderRequest("https://nightjarband.com", RenderJobType.WEB_PAGE, 1)
        )).isInstanceOf(RenderingException.class);
    }

    @Test
    void webCrawlInputLimitsPagesAndDepth() {
        ApifyRenderingClient client = client();

        JsonNode single = client.buildInput(new RenderRequest("https://nightjarband.com", RenderJobType.WEB_PAGE, 1));
        JsonNode multi = client.buildInput(new RenderRequest("https://linktr.ee/nightjar", RenderJobType.WEB_PAGE, 3));

        assertThat(single.path("maxCrawlDepth").asInt()).isZero();
        assertThat(multi.path("maxCrawlPages").asInt()).isEqualTo(3);
        assertThat(multi.path("maxCrawlDepth").asInt()).isEqualTo(1);
        assertThat(multi.path("startUrls").get(0).path("url").asText()).isEqualTo("https://linktr.ee/nightjar");
    }

    @Test
    void videoInputTargetsAboutPage() {
        JsonNode input = client().buildInput(
            new RenderRequest("https://www.youtube.com/@nightjar/", RenderJobType.VIDEO_PROFILE, 1)
        );

        assertThat(input.path("startUrls").get(0).path("url").asText()).isEqualTo("https://www.youtube.com/@nightjar/about");
        assertThat(ApifyRenderingClient.aboutPageUrl("https://www.youtube.com/@nightjar/about"))
            .isEqualTo("https://www.youtube.com/@nightjar/about");
    }

    @Test
    void photoHandleComesFromProfilePath() {
        assertThat(ApifyRenderingClient.photoHandle("https://www.instagram.com/nightjar/")).isEqualTo("nightjar");
        assertThat(ApifyRenderingClient.photoHandle("@nightjar")).isEqualTo("nightjar");
    }

    @Test
    void unconfiguredClientIsUnavailable() {
        properties.getRendering().setToken(null);

        assertThat(client().isAvailable()).isFalse();
        assertThatThrownBy(() -> client().render(
            new RenderRequest("https://nightjarband.com", RenderJobType.WEB_PAGE, 1)
        )).isInstanceOf(RenderingException.class);
    }

    private ApifyRenderingClient client() {
        return new ApifyRenderingClient(new PoliteHttpClient(properties, executor), objectMapper, properties);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }
}
