package com.artistreach.enrichment.step;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.ai.GenerativeExtractionCapability;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.EmailPatternScanner;
import com.artistreach.enrichment.fetch.ContentFetchCapability;
import com.artistreach.enrichment.filter.EmailQualityFilter;
import com.artistreach.enrichment.model.ArtistLinks;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.EmailCandidate;
import com.artistreach.enrichment.model.FetchOutcome;
import com.artistreach.enrichment.model.FetchTier;
import com.artistreach.enrichment.model.PlatformHint;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.service.EnrichmentCapabilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ArtistWebsiteStepHandlerTest {
    private static final String HOME = "https://nightjarband.com";
    private static final String HOME_HTML = """
        <html><body>
        <h1>Nightjar</h1>
        <a href="/press">Press kit</a>
        <a href="https://agency.example.org/contact">Agency contact</a>
        </body></html>""";

    private EnrichmentProperties properties;
    private ContentFetchCapability fetcher;
    private StepContext context;
    private ArtistWebsiteStepHandler handler;

    @BeforeEach
    void setUp() {
        properties = new EnrichmentProperties();
        properties.getFetch().setSubpageDelayMs(0);
        EmailExtractionService extraction =
            new EmailExtractionService(new EmailPatternScanner(), new EmailQualityFilter(properties), properties);
        fetcher = Mockito.mock(ContentFetchCapability.class);
        context = new StepContext(new EnrichmentCapabilities(fetcher, null, Mockito.mock(GenerativeExtractionCapability.class)));
        handler = new ArtistWebsiteStepHandler(extraction, properties);
    }

    @Test
    void subpagesStayOnTheSameSiteAndIncludeConventionalPaths() {
        FetchOutcome home = new FetchOutcome(HOME, HOME_HTML, FetchTier.DIRECT, false, null, null);

        assertThat(ArtistWebsiteStepHandler.subpages(home, 4)).containsExactly(
            "https://nightjarband.com/press",
            "https://nightjarband.com/contact",
            "https://nightjarband.com/booking",
            "https://nightjarband.com/about"
        );
        assertThat(ArtistWebsiteStepHandler.subpages(home, 2)).hasSize(2);
        assertThat(ArtistWebsiteStepHandler.subpages(home, 0)).isEmpty();
    }

    @Test
    void combinesHomepageWithSubpagesFetchedDirectly() {
        when(fetcher.fetch(anyString(), any(), anyBoolean()))
            .thenReturn(FetchOutcome.failed("x", FetchTier.DIRECT, false, "HTTP_404 (http_404)"));
        when(fetcher.fetch(eq(HOME), eq(PlatformHint.WEBSITE), eq(true)))
            .thenReturn(new FetchOutcome(HOME, HOME_HTML, FetchTier.DIRECT, false, null, null));
        when(fetcher.fetch(eq(HOME + "/contact"), eq(PlatformHint.WEBSITE), eq(false)))
            .thenReturn(new FetchOutcome(HOME + "/contact", "Booking: booking@nightjarband.com", FetchTier.DIRECT, false, null, null));

        StepOutcome outcome = handler.handle(profile(), context);

        assertThat(outcome.candidates()).extracting(EmailCandidate::email).containsExactly("booking@nightjarband.com");
        assertThat(outcome.candidates().get(0).confidence()).isEqualTo(0.8);
        assertThat(outcome.urlFetched()).isEqualTo(HOME);
        assertThat(outcome.rawContent()).contains("<h1>Nightjar</h1>").contains("booking@nightjarband.com");
        verify(fetcher).fetch(HOME + "/press", PlatformHint.WEBSITE, false);
        verify(fetcher).fetch(HOME + "/about", PlatformHint.WEBSITE, false);
    }

    @Test
    void unreachableHomepageFailsWithoutSubpages() {
        when(fetcher.fetch(eq(HOME), eq(PlatformHint.WEBSITE), anyBoolean()))
            .thenReturn(FetchOutcome.failed(HOME, FetchTier.RENDERED, false, "DNS_FAILURE (io_error)"));

        StepOutcome outcome = handler.handle(profile(), context);

        assertThat(outcome.candidates()).isEmpty();
        assertThat(outcome.failureReason()).isEqualTo("DNS_FAILURE (io_error)");
        verify(fetcher, Mockito.times(1)).fetch(anyString(), any(), anyBoolean());
    }

    private static ArtistProfile profile() {
        return new ArtistProfile("a-1", "Nightjar", new ArtistLinks(null, null, HOME, null), null, "GB", List.of(), null, null);
    }
}
