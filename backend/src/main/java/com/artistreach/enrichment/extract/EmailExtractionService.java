package com.artistreach.enrichment.extract;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.ExtractionParseException;
import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.ai.GenerativeReply;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.filter.EmailQualityFilter;
import com.artistreach.enrichment.model.EmailCandidate;
import com.artistreach.enrichment.model.ExtractionPath;
import com.artistreach.enrichment.model.ExtractionResult;
import com.artistreach.enrichment.model.FilterResult;
import com.artistreach.enrichment.model.RejectedEmail;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs the extraction paths in order of trust: structured fields, then the pattern scan, then a
 * generative read of the page text. The first path that yields a filter-accepted address wins.
 */
@Service
public class EmailExtractionService {
    private static final Logger log = LoggerFactory.getLogger(EmailExtractionService.class);

    public static final String NOT_VERBATIM_REASON =
        ReasonCodeClassifier.NOT_VERBATIM_IN_SOURCE.toLowerCase(Locale.ROOT);

    static final String EXTRACTION_PROMPT = """
        Find the business, booking or management contact email for the music artist "%s" in the \
        CONTENT below.
        Only report an email address that appears character for character in the CONTENT. Never \
        guess, complete or construct an address. If there is none, use null.
        Reply with exactly this JSON object and nothing else:
        {"email": "<address or null>", "source": "<where in the content it appears>"}""";

    private static final Pattern MARKUP = Pattern.compile(
        "<(?:!doctype|html|head|body|div|p|span|a|section|main|script|style)\\b",
        Pattern.CASE_INSENSITIVE
    );

    private final EmailPatternScanner scanner;
    private final EmailQualityFilter qualityFilter;
    private final EnrichmentProperties properties;

    public EmailExtractionService(
        EmailPatternScanner scanner,
        EmailQualityFilter qualityFilter,
        EnrichmentProperties properties
    ) {
        this.scanner = scanner;
        this.qualityFilter = qualityFilter;
        this.properties = properties;
    }

    public ExtractionResult extract(ExtractionRequest request, GenerativeExtractionCapability generative) {
        List<RejectedEmail> rejected = new ArrayList<>();
        String content = request.content();

        ExtractionResult structured = fromStructuredFields(request, rejected);
        if (structured != null) {
            return structured;
        }

        List<String> scanned = scanner.scan(content);
        if (!scanned.isEmpty()) {
            FilterResult filtered = qualityFilter.filterEmails(scanned);
            rejected.addAll(filtered.rejected());
            if (filtered.hasAccepted()) {
                List<EmailCandidate> candidates = new ArrayList<>();
                for (String email : filtered.accepted()) {
                    candidates.add(new EmailCandidate(email, null, request.patternConfidence(), ExtractionPath.PATTERN_SCAN));
                }
                return new ExtractionResult(candidates, request.patternConfidence(), content, ExtractionPath.PATTERN_SCAN, rejected);
            }
        }

        if (request.allowGenerative()) {
            String text = pageText(content);
            if (shouldAskModel(text, generative)) {
                return fromGenerative(request, text, generative, rejected);
            }
        }
        return ExtractionResult.none(content, rejected);
    }

    private ExtractionResult fromStructuredFields(ExtractionRequest request, List<RejectedEmail> rejected) {
        if (request.structuredValues().isEmpty()) {
            return null;
        }
        Map<String, Double> confidenceByEmail = new LinkedHashMap<>();
        for (ExtractionRequest.StructuredValue value : request.structuredValues()) {
            String email = value.value().toLowerCase(Locale.ROOT);
            confidenceByEmail.merge(email, value.confidence(), Math::max);
        }
        FilterResult filtered = qualityFilter.filterEmails(confidenceByEmail.keySet());
        rejected.addAll(filtered.rejected());
        if (!filtered.hasAccepted()) {
            return null;
        }
        List<EmailCandidate> candidates = new ArrayList<>();
        double best = 0.0;
        for (String email : filtered.accepted()) {
            double confidence = confidenceByEmail.getOrDefault(email, 0.0);
            best = Math.max(best, confidence);
            candidates.add(new EmailCandidate(email, null, confidence, ExtractionPath.STRUCTURED_FIELD));
        }
        return new ExtractionResult(candidates, best, request.content(), ExtractionPath.STRUCTURED_FIELD, rejected);
    }

    private boolean shouldAskModel(String content, GenerativeExtractionCapability generative) {
        if (generative == null || !generative.isAvailable(GenerativeTier.FAST)) {
            return false;
        }
        return content != null && content.trim().length() > properties.getFetch().getMinGenerativeContentChars();
    }

    private ExtractionResult fromGenerative(
        ExtractionRequest request,
        String text,
        GenerativeExtractionCapability generative,
        List<RejectedEmail> rejected
    ) {
        String literal = truncate(text, properties.getPipeline().getMaxGenerativeContentChars());
        String prompt = EXTRACTION_PROMPT.formatted(request.artistName() == null ? "" : request.artistName());
        GenerativeReply reply;
        try {
            reply = generative.extract(GenerativeTier.FAST, prompt, literal);
        } catch (ExtractionParseException e) {
            log.warn("Unparseable generative reply for {}: {}", request.artistName(), e.getMessage());
            return ExtractionResult.none(literal, rejected);
        }
        if (reply == null || !reply.hasEmail()) {
            return ExtractionResult.none(literal, rejected);
        }
        String email = reply.email().trim().toLowerCase(Locale.ROOT);
        if (!VerbatimContentGuard.appearsIn(email, literal)) {
            log.info("Discarded generative email {} for {}: not present in the supplied content", email, request.artistName());
            rejected.add(new RejectedEmail(email, NOT_VERBATIM_REASON, null));
            return ExtractionResult.none(literal, rejected);
        }
        FilterResult filtered = qualityFilter.filterEmails(List.of(email));
        rejected.addAll(filtered.rejected());
        if (!filtered.hasAccepted()) {
            return ExtractionResult.none(literal, rejected);
        }
        EmailCandidate candidate = new EmailCandidate(
            filtered.accepted().get(0),
            null,
            request.generativeConfidence(),
            ExtractionPath.GENERATIVE
        );
        return new ExtractionResult(List.of(candidate), request.generativeConfidence(), literal, ExtractionPath.GENERATIVE, rejected);
    }

    /**
     * Visible body text of an HTML page; anything that does not look like markup is returned as is.
     */
    static String pageText(String content) {
        if (content == null) {
            return "";
        }
        if (!MARKUP.matcher(content).find()) {
            return content;
        }
        Document document = Jsoup.parse(content);
        return document.body() == null ? document.text() : document.body().text();
    }

    static String truncate(String content, int maxChars) {
        if (content == null) {
            return "";
        }
        return content.length() <= maxChars ? content : content.substring(0, maxChars);
    }
}
