package org.dpg.jobprocessor.service.catalog;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarcYearParserTest {

    @ParameterizedTest
    @CsvSource({
            "'[1887?]', 1887",
            "'c1923.', 1923",
            "'19--', 1999",
            "'195-', 1959",
            "'1901-05', 1905",
            "'1901-1910', 1910",
            "'1923.0', 1923",
            "'MDCCCXC', 1890",
            "'London, 1850, reprinted 1872', 1872"
    })
    void normalizesPublicationDates(final String raw, final int expected) {
        assertThat(MarcYearParser.parseYear(raw)).isEqualTo(expected);
    }

    @Test
    void unparseableDateIsZero() {
        assertThat(MarcYearParser.parseYear(null)).isZero();
        assertThat(MarcYearParser.parseYear("[ ]")).isZero();
        assertThat(MarcYearParser.parseYear("n.d.")).isZero();
    }

    @Test
    void romanNumeralsConvert() {
        assertThat(MarcYearParser.romanToArabic("MCMXXII")).isEqualTo(1922);
        assertThat(MarcYearParser.romanToArabic("")).isZero();
    }
}
