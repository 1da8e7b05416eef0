package com.artistreach.enrichment.http;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.model.HttpFetchResult;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared HTTP client for every downstream service. Spacing is enforced per host, so the configured
 * delay holds per service no matter how many callers share the client.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    public static final String JSON_ACCEPT = "application/json";

    static final String INVALID_URL = "invalid_url";
    static final String TIMEOUT = "timeout";
    static final String IO_ERROR = "io_error";
    static final String INTERRUPTED = "interrupted";
    static final String HTTP_ERROR = "http_error";

    private static final Duration THROTTLED_PAUSE = Duration.ofSeconds(30);
    private static final Set<Integer> THROTTLE_STATUSES = Set.of(403, 429);
    private static final Set<String> TERMINAL_ERRORS = Set.of(INVALID_URL, INTERRUPTED);

    private final EnrichmentProperties properties;
    private final HttpClient client;
    private final Semaphore inFlight;
    private final Map<String, HostThrottle> throttles = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        EnrichmentProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.inFlight = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> headers) {
        return withRetries(new Call(url, "GET", acceptHeader, null, headers));
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return withRetries(new Call(url, "POST", JSON_ACCEPT, jsonBody == null ? "" : jsonBody, headers));
    }

    private HttpFetchResult withRetries(Call call) {
        int attempts = 1 + Math.max(0, properties.getRequestMaxRetries());
        int attempt = 0;
        while (true) {
            attempt++;
            RunDeadlineContext.checkDeadline();
            HttpFetchResult result = attempt(call);
            if (attempt >= attempts || !retryable(result)) {
                return result;
            }
            log.debug("Retrying {} {} after attempt {} ({})", call.method(), withoutQuery(call.url()), attempt, result.failureKey());
            if (!pauseBeforeRetry(attempt)) {
                return result;
            }
        }
    }

    private HttpFetchResult attempt(Call call) {
        Instant startedAt = Instant.now();
        URI uri = parseTarget(call.url());
        if (uri == null) {
            return failure(call.url(), startedAt, INVALID_URL, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(call.url(), startedAt, INTERRUPTED, e.getMessage());
        }
        try {
            throttleFor(host).awaitTurn(properties.getPerHostDelayMs());
            RunDeadlineContext.checkDeadline();
            HttpResponse<byte[]> response = client.send(buildRequest(uri, call), HttpResponse.BodyHandlers.ofByteArray());
            if (THROTTLE_STATUSES.contains(response.statusCode())) {
                throttleFor(host).pushBack(THROTTLED_PAUSE);
            }
            return success(call, response, startedAt, host);
        } catch (HttpTimeoutException e) {
            return failure(call.url(), startedAt, TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return failure(call.url(), startedAt, IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(call.url(), startedAt, INTERRUPTED, e.getMessage());
        } catch (IllegalArgumentException e) {
            return failure(call.url(), startedAt, HTTP_ERROR, e.getMessage());
        } finally {
            inFlight.release();
        }
    }

    private HttpRequest buildRequest(URI uri, Call call) {
        String accept = call.accept() == null || call.accept().isBlank() ? "*/*" : call.accept();
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(RunDeadlineContext.cap(Duration.ofSeconds(properties.getRequestTimeoutSeconds())))
            .header("User-Agent", EnrichmentProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", accept)
            .header("Accept-Language", "en-US,en;q=0.9");
        if (call.headers() != null) {
            call.headers().forEach(builder::header);
        }
        if ("POST".equals(call.method())) {
            return builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(call.body(), StandardCharsets.UTF_8))
                .build();
        }
        return builder.GET().build();
    }

    private HttpFetchResult success(Call call, HttpResponse<byte[]> response, Instant startedAt, String host) {
        byte[] bytes = response.body();
        int size = bytes == null ? 0 : bytes.length;
        log.debug("{} {} -> {} ({} bytes)", call.method(), host, response.statusCode(), size);
        Instant finishedAt = Instant.now();
        return new HttpFetchResult(
            call.url(),
            response.uri(),
            response.statusCode(),
            bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
            response.headers().firstValue("Content-Type").orElse(null),
            finishedAt,
            Duration.between(startedAt, finishedAt),
            null,
            null
        );
    }

    private HttpFetchResult failure(String url, Instant startedAt, String code, String message) {
        Instant finishedAt = Instant.now();
        return new HttpFetchResult(url, null, 0, null, null, finishedAt, Duration.between(startedAt, finishedAt), code, message);
    }

    private static boolean retryable(HttpFetchResult result) {
        if (result.errorCode() != null && !result.errorCode().isBlank()) {
            return !TERMINAL_ERRORS.contains(result.errorCode());
        }
        // 429 waits out the host pause instead of hammering it again
        if (result.statusCode() == 429) {
            return false;
        }
        return ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(result.statusCode()));
    }

    private boolean pauseBeforeRetry(int attempt) {
        long delayMs = retryDelayMs(attempt);
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long retryDelayMs(int attempt) {
        long base = properties.getRequestRetryBaseDelayMs();
        if (base <= 0) {
            return 0;
        }
        long ceiling = base << Math.min(20, Math.max(0, attempt - 1));
        if (properties.getRequestRetryMaxDelayMs() > 0) {
            ceiling = Math.min(ceiling, properties.getRequestRetryMaxDelayMs());
        }
        long half = ceiling / 2;
        return half + ThreadLocalRandom.current().nextLong(Math.max(1L, ceiling - half));
    }

    private HostThrottle throttleFor(String host) {
        return throttles.computeIfAbsent(host, ignored -> new HostThrottle());
    }

    private static URI parseTarget(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Scheme, host and path only. Query strings carry API keys and tokens and never reach the log.
     */
    static String withoutQuery(String url) {
        if (url == null) {
            return null;
        }
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = query;
        }
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return url.substring(0, cut);
    }

    private record Call(String url, String method, String accept, String body, Map<String, String> headers) {
    }

    /**
     * Earliest instant the next request to one host may start.
     */
    private static final class HostThrottle {
        private Instant nextSlot = Instant.EPOCH;

        synchronized void awaitTurn(int spacingMs) throws InterruptedException {
            long waitMs = Duration.between(Instant.now(), nextSlot).toMillis();
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
            nextSlot = Instant.now().plusMillis(Math.max(1, spacingMs));
        }

        synchronized void pushBack(Duration pause) {
            Instant until = Instant.now().plus(pause);
            if (until.isAfter(nextSlot)) {
                nextSlot = until;
            }
        }
    }
}
