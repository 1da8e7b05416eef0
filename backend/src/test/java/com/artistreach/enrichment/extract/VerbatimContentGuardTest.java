package com.artistreach.enrichment.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerbatimContentGuardTest {

    @Test
    void matchesIgnoringCase() {
        assertThat(VerbatimContentGuard.appearsIn("booking@band.com", "Write to BOOKING@Band.com today")).isTrue();
    }

    @Test
    void rejectsAddressesAbsentFromContent() {
        assertThat(VerbatimContentGuard.appearsIn("booking@band.com", "Write to booking at band dot com")).isFalse();
        assertThat(VerbatimContentGuard.appearsIn("booking@band.com", null)).isFalse();
        assertThat(VerbatimContentGuard.appearsIn(" ", "anything")).isFalse();
    }
}
