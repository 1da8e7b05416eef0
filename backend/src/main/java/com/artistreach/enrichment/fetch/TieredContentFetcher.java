package com.artistreach.enrichment.fetch;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.http.PoliteHttpClient;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.FetchTier;
import com.artistreach.enrichment.model.HttpFetchResult;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-tier fetch: a direct GET first, and a managed rendering job when the direct response is
 * missing, too short, or a block page. A rendering failure is final for the call.
 */
public class TieredContentFetcher implements ContentFetchCapability {
    private static final Logger log = LoggerFactory.getLogger(TieredContentFetcher.class);

    private final PoliteHttpClient httpClient;
    private final BlockedContentDetector blockedContentDetector;
    private final ManagedRenderingCapability rendering;
    private final EnrichmentProperties properties;

    public TieredContentFetcher(
        PoliteHttpClient httpClient,
        BlockedContentDetector blockedContentDetector,
        ManagedRenderingCapability rendering,
        EnrichmentProperties properties
    ) {
        this.httpClient = httpClient;
        this.blockedContentDetector = blockedContentDetector;
        this.rendering = rendering;
        this.properties = properties;
    }

    @Override
    public FetchOutcome fetch(String url, PlatformHint hint, boolean allowRendering) {
        HttpFetchResult direct = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT);
        String diagnostic;
        boolean blocked = false;
        String thinContent = null;
        String finalUrl = direct == null ? url : direct.finalUrlOrRequested();

        if (direct != null && direct.isSuccessful() && direct.hasBody()) {
            String body = direct.body();
            Optional<String> signature = blockedContentDetector.detect(body, hint);
            int minChars = properties.getFetch().getMinContentChars();
            if (signature.isEmpty() && body.length() >= minChars) {
                log.debug("Direct fetch ok for {} ({} chars)", url, body.length());
                return new FetchOutcome(finalUrl, body, FetchTier.DIRECT, false, null, Map.of());
            }
            if (signature.isPresent()) {
                blocked = true;
                diagnostic = ReasonCodeClassifier.CONTENT_BLOCKED + " (" + signature.get() + ")";
            } else {
                thinContent = body;
                diagnostic = ReasonCodeClassifier.CONTENT_TOO_SMALL + " (" + body.length() + " chars)";
            }
        } else if (direct == null) {
            diagnostic = ReasonCodeClassifier.UNKNOWN;
        } else {
            diagnostic = ReasonCodeClassifier.describeFetchFailure(
                direct.errorCode(),
                direct.statusCode(),
                direct.errorMessage()
            );
        }

        if (!allowRendering || rendering == null || !rendering.isAvailable()) {
            log.debug("Direct fetch insufficient for {} ({}); no rendering fallback", url, diagnostic);
            String reason = allowRendering ? diagnostic + "; " + ReasonCodeClassifier.RENDERING_UNAVAILABLE : diagnostic;
            if (thinContent != null) {
                return new FetchOutcome(finalUrl, thinContent, FetchTier.DIRECT, false, reason, Map.of());
            }
            return FetchOutcome.failed(url, FetchTier.DIRECT, blocked, reason);
        }

        RenderJobType jobType = RenderJobType.forHint(hint);
        int maxPages = jobType == RenderJobType.WEB_PAGE ? properties.getRendering().getMaxCrawlPages() : 1;
        log.info("Falling back to rendering for {} ({}): {}", url, jobType, diagnostic);
        List<RenderedPage> pages;
        try {
            pages = rendering.render(new RenderRequest(url, jobType, maxPages));
        } catch (RenderingException e) {
            log.warn("Rendering failed for {}: {}", url, e.getMessage());
            return FetchOutcome.failed(url, FetchTier.RENDERED, blocked, e.getReasonCode() + " (" + e.getMessage() + ")");
        }
        return combine(url, pages, blocked, diagnostic);
    }

    private FetchOutcome combine(String url, List<RenderedPage> pages, boolean blocked, String diagnostic) {
        StringBuilder text = new StringBuilder();
        Map<String, String> fields = new LinkedHashMap<>();
        for (RenderedPage page : pages) {
            if (page.hasText()) {
                if (text.length() > 0) {
                    text.append("\n\n");
                }
                text.append(page.text());
            }
            page.structuredFields().forEach(fields::putIfAbsent);
        }
        if (text.length() == 0 && fields.isEmpty()) {
            return FetchOutcome.failed(url, FetchTier.RENDERED, blocked, ReasonCodeClassifier.RENDERING_FAILED + " (no items)");
        }
        String content = text.length() == 0 ? null : text.toString();
        return new FetchOutcome(url, content, FetchTier.RENDERED, blocked, diagnostic, fields);
    }
}
