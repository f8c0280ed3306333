package com.micaixbrl.core.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NumericValueExtractor}.
 */
class NumericValueExtractorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "€1,500.00 per subscription | 1,500.00",
        "A fee of EUR 25 applies    | 25",
        "Fee: 500 USD               | 500",
        "Up to 2.5% of the amount   | 2.5",
        "$0.10 per token            | 0.10"
    })
    void extract_currencyOrUnitAdjacent_returnsThatNumber(String text, String expected) {
        assertThat(NumericValueExtractor.extract(text)).isEqualTo(expected);
    }

    @Test
    void extract_noDigits_returnsEmpty() {
        assertThat(NumericValueExtractor.extract("Not applicable, no fee is charged")).isEmpty();
    }

    @Test
    void extract_nullOrBlank_returnsEmpty() {
        assertThat(NumericValueExtractor.extract(null)).isEmpty();
        assertThat(NumericValueExtractor.extract("   ")).isEmpty();
    }

    @Test
    void extract_yearBeforeQuantity_skipsYear() {
        assertThat(NumericValueExtractor.extract("Launched in 2024 with 600 validators")).isEqualTo("600");
    }

    @Test
    void extract_onlyDatesAndTimes_returnsEmpty() {
        assertThat(NumericValueExtractor.extract("Opens 2025-03-01 at 10:00 and closes 31/03/2025")).isEmpty();
    }

    @Test
    void extract_thousandsSeparatedQuantity_keepsSeparators() {
        assertThat(NumericValueExtractor.extract("A total of 21,000,000 tokens")).isEqualTo("21,000,000");
    }

    @Test
    void detectCurrency_symbolsAndCodes() {
        assertThat(NumericValueExtractor.detectCurrency("€5")).contains("EUR");
        assertThat(NumericValueExtractor.detectCurrency("5 usd")).contains("USD");
        assertThat(NumericValueExtractor.detectCurrency("£5")).contains("GBP");
        assertThat(NumericValueExtractor.detectCurrency("CHF 5")).contains("CHF");
        assertThat(NumericValueExtractor.detectCurrency("5 tokens")).isEmpty();
        assertThat(NumericValueExtractor.detectCurrency(null)).isEmpty();
    }
}
