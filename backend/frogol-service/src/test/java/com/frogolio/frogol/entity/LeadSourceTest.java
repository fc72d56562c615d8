package com.frogolio.frogol.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LeadSource scoring")
class LeadSourceTest {

    @Test
    @DisplayName("Should score known sources")
    void shouldScoreKnownSources() {
        assertThat(LeadSource.scoreFor("direct")).isEqualTo(100);
        assertThat(LeadSource.scoreFor("referral")).isEqualTo(90);
        assertThat(LeadSource.scoreFor("social")).isEqualTo(80);
    }

    @Test
    @DisplayName("Should fall back to the default for unknown, null or differently cased sources")
    void shouldFallBackToDefault() {
        assertThat(LeadSource.scoreFor("newsletter")).isEqualTo(LeadSource.DEFAULT_SCORE);
        assertThat(LeadSource.scoreFor(null)).isEqualTo(70);
        assertThat(LeadSource.scoreFor("Direct")).isEqualTo(70);
    }
}
