package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.ExtractionParseException;
import com.artistreach.enrichment.ai.GenerativeReply;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.VerbatimContentGuard;
import com.artistreach.enrichment.filter.EmailQualityFilter;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.AuxiliaryFields;
import com.artistreach.enrichment.model.EmailCandidate;
import com.artistreach.enrichment.model.ExtractionPath;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.FilterResult;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.model.RejectedEmail;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Last resort: a web-search backed model names an email and the page it read it on. The email is
 * only kept when that page, fetched here, contains it literally. Management and booking details are
 * kept either way.
 */
@Component
public class WebSearchStepHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSearchStepHandler.class);

    static final String DEEP_DIVE_PROMPT = """
        Search the web for the business contact of the music artist "%s"%s.
        Look for a booking, management or press email on the artist's official website, link-in-bio \
        pages, profile about sections, agency rosters and interviews.
        Only report an email you actually read on a page, and give the URL of that page.
        Reply with exactly this JSON object and nothing else, using null for anything you did not find:
        {"email": "<address>", "source_url": "<page the email appears on>", "website": "<official website>", \
        "management": "<management company or manager>", "booking_agent": "<booking agent or agency>"}""";

    private final EmailQualityFilter qualityFilter;
    private final EnrichmentProperties properties;

    public WebSearchStepHandler(EmailQualityFilter qualityFilter, EnrichmentProperties properties) {
        this.qualityFilter = qualityFilter;
        this.properties = properties;
    }

    @Override
    public StepOutcome handle(ArtistProfile profile, StepContext context) {
        GenerativeReply reply;
        try {
            reply = context.capabilities().generative().extract(GenerativeTier.DEEP, buildPrompt(profile), null);
        } catch (ExtractionParseException e) {
            log.warn("Unparseable deep-dive reply for {}: {}", profile.name(), e.getMessage());
            return StepOutcome.failure(null, ReasonCodeClassifier.GENERATIVE_PARSE_FAILED);
        }

        StepOutcome.Builder outcome = StepOutcome.builder()
            .auxiliary(new AuxiliaryFields(reply.website(), reply.management(), reply.bookingAgent()));
        if (!reply.hasEmail()) {
            return outcome.build();
        }

        String email = reply.email().trim().toLowerCase(Locale.ROOT);
        String sourceUrl = reply.sourceUrl() == null || reply.sourceUrl().isBlank() ? reply.source() : reply.sourceUrl();
        if (sourceUrl == null || sourceUrl.isBlank() || !sourceUrl.trim().toLowerCase(Locale.ROOT).startsWith("http")) {
            log.info("Deep dive for {} named {} without a source page", profile.name(), email);
            return outcome
                .rejected(List.of(new RejectedEmail(email, EmailExtractionService.NOT_VERBATIM_REASON, null)))
                .failureReason(ReasonCodeClassifier.NOT_VERBATIM_IN_SOURCE)
                .build();
        }

        FetchOutcome source = context.capabilities().contentFetch().fetch(sourceUrl.trim(), PlatformHint.WEBSITE, true);
        outcome.fetch(source);
        if (source == null || !source.hasContent() || !VerbatimContentGuard.appearsIn(email, source.content())) {
            log.info("Deep dive email {} for {} not found on {}", email, profile.name(), sourceUrl);
            return outcome
                .rejected(List.of(new RejectedEmail(email, EmailExtractionService.NOT_VERBATIM_REASON, null)))
                .failureReason(ReasonCodeClassifier.NOT_VERBATIM_IN_SOURCE)
                .build();
        }

        FilterResult filtered = qualityFilter.filterEmails(List.of(email));
        outcome.rejected(filtered.rejected());
        for (String accepted : filtered.accepted()) {
            outcome.candidate(new EmailCandidate(
                accepted,
                null,
                properties.getConfidence().getWebSearch(),
                ExtractionPath.WEB_SEARCH
            ));
        }
        return outcome.rawContent(source.content()).build();
    }

    String buildPrompt(ArtistProfile profile) {
        StringBuilder context = new StringBuilder();
        if (profile.country() != null && !profile.country().isBlank()) {
            context.append(" from ").append(profile.country());
        }
        if (!profile.genres().isEmpty()) {
            context.append(" (").append(String.join(", ", profile.genres())).append(')');
        }
        return DEEP_DIVE_PROMPT.formatted(profile.name(), context);
    }
}
