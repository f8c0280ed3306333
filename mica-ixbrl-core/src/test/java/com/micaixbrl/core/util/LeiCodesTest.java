package com.micaixbrl.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LeiCodes}.
 */
class LeiCodesTest {

    @ParameterizedTest
    @ValueSource(strings = {"529900T8BM49AURSDO55", "5493001KJTIIGC8Y1R12", "213800ABCDEFGHIJKL82"})
    void hasValidChecksum_knownIdentifiers_returnsTrue(String lei) {
        assertThat(LeiCodes.hasValidChecksum(lei)).isTrue();
    }

    @Test
    void hasValidChecksum_lastDigitChanged_returnsFalse() {
        assertThat(LeiCodes.hasValidChecksum("529900T8BM49AURSDO56")).isFalse();
    }

    @Test
    void hasValidChecksum_lowercaseWithWhitespace_normalizesFirst() {
        assertThat(LeiCodes.hasValidChecksum("  529900t8bm49aursdo55 ")).isTrue();
    }

    @Test
    void hasValidChecksum_malformed_returnsFalse() {
        assertThat(LeiCodes.hasValidChecksum("12345")).isFalse();
        assertThat(LeiCodes.hasValidChecksum(null)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "529900T8BM49AURSDO5", "529900T8BM49AURSDO555", "529900T8BM49AURSDOAB", "5299-0T8BM49AURSDO55"})
    void isWellFormed_wrongShape_returnsFalse(String lei) {
        assertThat(LeiCodes.isWellFormed(lei)).isFalse();
    }

    @Test
    void isWellFormed_checksumNotConsidered() {
        assertThat(LeiCodes.isWellFormed("529900T8BM49AURSDO56")).isTrue();
    }

    @Test
    void normalize_null_returnsEmpty() {
        assertThat(LeiCodes.normalize(null)).isEmpty();
        assertThat(LeiCodes.normalize(" abc ")).isEqualTo("ABC");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Not applicable", "N/A (not applicable)", "NOT  APPLICABLE", "not\tapplicable"})
    void isNotApplicable_placeholders_returnsTrue(String value) {
        assertThat(LeiCodes.isNotApplicable(value)).isTrue();
    }

    @Test
    void isNotApplicable_identifier_returnsFalse() {
        assertThat(LeiCodes.isNotApplicable("529900T8BM49AURSDO55")).isFalse();
        assertThat(LeiCodes.isNotApplicable(null)).isFalse();
    }
}
