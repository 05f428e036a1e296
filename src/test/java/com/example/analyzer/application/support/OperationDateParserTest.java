package com.example.analyzer.application.support;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for day-first operation date parsing.
 */
class OperationDateParserTest {

    private final OperationDateParser parser = OperationDateParser.defaults();

    /**
     * Ensures every default day-first and ISO format is accepted.
     */
    @Test
    void parseSupportsDayFirstAndIsoFormats() {
        LocalDate expected = LocalDate.of(2024, 2, 5);

        assertThat(parser.parse("05.02.2024")).isEqualTo(expected);
        assertThat(parser.parse("05.02.24")).isEqualTo(expected);
        assertThat(parser.parse("05/02/2024")).isEqualTo(expected);
        assertThat(parser.parse("05-02-2024")).isEqualTo(expected);
        assertThat(parser.parse("2024-02-05")).isEqualTo(expected);
    }

    /**
     * Ensures a trailing time part is ignored.
     */
    @Test
    void parseIgnoresTimePart() {
        assertThat(parser.parse("05.02.2024 23:59:01")).isEqualTo(LocalDate.of(2024, 2, 5));
        assertThat(parser.parse("2024-02-05T10:15:30")).isEqualTo(LocalDate.of(2024, 2, 5));
    }

    /**
     * Ensures impossible dates and free text are rejected.
     */
    @Test
    void parseRejectsImpossibleAndGarbageDates() {
        assertThat(parser.parse("31.02.2024")).isNull();
        assertThat(parser.parse("Итого")).isNull();
        assertThat(parser.parse(null)).isNull();
    }

    /**
     * Ensures bank-specific patterns take precedence over the defaults.
     */
    @Test
    void withPatternsTriesBankPatternsFirst() {
        OperationDateParser monthFirst = OperationDateParser.withPatterns(List.of("MM/dd/uuuu"));

        assertThat(monthFirst.parse("02/05/2024")).isEqualTo(LocalDate.of(2024, 2, 5));
    }
}
