package com.artistreach.enrichment.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmailPatternScannerTest {
    private final EmailPatternScanner scanner = new EmailPatternScanner();

    @Test
    void findsMailtoLinksAndPlainTextAddresses() {
        String html = """
            <html><body>
              <a href="mailto:Booking@NightjarBand.com?subject=Show">Booking</a>
              <p>Management: mgmt@redlightmgmt.com.</p>
            </body></html>
            """;

        List<String> emails = scanner.scan(html);

        assertThat(emails).containsExactly("booking@nightjarband.com", "mgmt@redlightmgmt.com");
    }

    @Test
    void stripsSurroundingPunctuation() {
        assertThat(scanner.scan("Contact (press@nightjarband.com); thanks"))
            .containsExactly("press@nightjarband.com");
    }

    @Test
    void dropsEncodedMailtoTargetsThatAreNotLiterallyPresent() {
        String html = "<a href=\"mailto:booking%40nightjarband.com\">write us</a>";

        assertThat(scanner.scan(html)).isEmpty();
    }

    @Test
    void blankContentYieldsNothing() {
        assertThat(scanner.scan(null)).isEmpty();
        assertThat(scanner.scan("   ")).isEmpty();
        assertThat(scanner.scan("no addresses in this bio")).isEmpty();
    }

    @Test
    void normalizeCandidateRejectsJunk() {
        assertThat(EmailPatternScanner.normalizeCandidate("\"Hello@Band.com\",")).isEqualTo("hello@band.com");
        assertThat(EmailPatternScanner.normalizeCandidate("@band.com")).isNull();
        assertThat(EmailPatternScanner.normalizeCandidate(null)).isNull();
    }
}
