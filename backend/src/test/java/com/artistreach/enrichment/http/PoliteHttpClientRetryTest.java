package com.artistreach.enrichment.http;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.model.HttpFetchResult;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        EnrichmentProperties properties = new EnrichmentProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);

        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
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
    void retriesServerErrorsThenSucceeds() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult result = client.get(server.url("/page").toString(), PoliteHttpClient.HTML_ACCEPT);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void failsFastOn429() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("rate limit"));

        HttpFetchResult result = client.get(server.url("/limited").toString(), "text/plain");

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void notFoundIsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/plain");

        assertThat(result.failureKey()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void malformedUrlNeverLeavesTheClient() {
        HttpFetchResult result = client.get("http://", "text/plain");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void postsJsonWithExtraHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"data\": {}}"));

        HttpFetchResult result = client.postJson(
            server.url("/runs").toString(),
            "{\"maxItems\": 1}",
            Map.of("X-Request-Source", "enrichment")
        );

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getHeader("X-Request-Source")).isEqualTo("enrichment");
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"maxItems\": 1}");
    }

    @Test
    void expiredRunDeadlineStopsRequests() {
        RunDeadline expired = RunDeadline.after(Duration.ZERO, "test artist");

        try (RunDeadlineContext.Scope ignored = RunDeadlineContext.activate(expired)) {
            assertThatThrownBy(() -> client.get(server.url("/late").toString(), "text/plain"))
                .isInstanceOf(RunDeadlineExceededException.class);
        }
        assertThat(server.getRequestCount()).isZero();
        assertThat(RunDeadlineContext.current()).isNull();
    }

    @Test
    void retryLogNeverCarriesTheQueryString() {
        Logger logger = (Logger) LoggerFactory.getLogger(PoliteHttpClient.class);
        Level previous = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        try {
            HttpFetchResult result = client.get(server.url("/actor-runs/r1?token=SUPERSECRET").toString(), PoliteHttpClient.JSON_ACCEPT);
            assertThat(result.isSuccessful()).isTrue();
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previous);
        }

        assertThat(appender.list)
            .extracting(ILoggingEvent::getFormattedMessage)
            .anySatisfy(line -> assertThat(line).startsWith("Retrying GET").contains("/actor-runs/r1"))
            .noneSatisfy(line -> assertThat(line).contains("SUPERSECRET"));
    }

    @Test
    void withoutQueryKeepsSchemeHostAndPath() {
        assertThat(PoliteHttpClient.withoutQuery("https://www.googleapis.com/youtube/v3/channels?part=snippet&key=abc"))
            .isEqualTo("https://www.googleapis.com/youtube/v3/channels");
        assertThat(PoliteHttpClient.withoutQuery("https://artist.example/press#contact")).isEqualTo("https://artist.example/press");
        assertThat(PoliteHttpClient.withoutQuery("https://artist.example/")).isEqualTo("https://artist.example/");
    }
}
