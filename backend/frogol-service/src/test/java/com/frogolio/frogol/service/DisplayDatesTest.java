package com.frogolio.frogol.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DisplayDates")
class DisplayDatesTest {

    @Test
    @DisplayName("Should format as month day, year at 12-hour time")
    void shouldFormat() {
        assertThat(DisplayDates.format(LocalDateTime.of(2025, 8, 7, 15, 4))).isEqualTo("Aug 07, 2025 at 03:04 PM");
    }

    @Test
    @DisplayName("Should return an empty string for null")
    void shouldHandleNull() {
        assertThat(DisplayDates.format(null)).isEmpty();
    }
}
