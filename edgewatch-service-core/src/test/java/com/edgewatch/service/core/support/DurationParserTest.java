package com.edgewatch.service.core.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationParserTest {

    @Test
    void parsesShortForms() {
        assertThat(DurationParser.parse("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(DurationParser.parse("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(DurationParser.parse("2h")).isEqualTo(Duration.ofHours(2));
        assertThat(DurationParser.parse("1d")).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void parsesIso() {
        assertThat(DurationParser.parse("PT15M")).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> DurationParser.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("5x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("abcm")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("PTxyz")).isInstanceOf(IllegalArgumentException.class);
    }
}
