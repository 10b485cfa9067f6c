package org.stepreduce.step;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumberNormalizerTest {

    @Test
    void normalize_unifiesSpellingsOfSameReal() {
        String one = NumberNormalizer.normalize("1.");

        assertThat(NumberNormalizer.normalize("1.0")).isEqualTo(one);
        assertThat(NumberNormalizer.normalize("1.0E0")).isEqualTo(one);
        assertThat(NumberNormalizer.normalize("+1.000")).isEqualTo(one);
        assertThat(NumberNormalizer.normalize("0.1E1")).isEqualTo(one);
        assertThat(NumberNormalizer.normalize("1E0")).isEqualTo(one);
    }

    @Test
    void normalize_keepsIntegerAndRealApart() {
        assertThat(NumberNormalizer.normalize("1")).isNotEqualTo(NumberNormalizer.normalize("1."));
        assertThat(NumberNormalizer.normalize("0")).isNotEqualTo(NumberNormalizer.normalize("0."));
        assertThat(NumberNormalizer.isReal("12")).isFalse();
        assertThat(NumberNormalizer.isReal("-12")).isFalse();
        assertThat(NumberNormalizer.isReal("1.")).isTrue();
        assertThat(NumberNormalizer.isReal("1E3")).isTrue();
    }

    @Test
    void normalize_unifiesIntegerSignAndLeadingZeros() {
        assertThat(NumberNormalizer.normalize("+7")).isEqualTo(NumberNormalizer.normalize("7"));
        assertThat(NumberNormalizer.normalize("007")).isEqualTo(NumberNormalizer.normalize("7"));
        assertThat(NumberNormalizer.normalize("-0")).isEqualTo(NumberNormalizer.normalize("0"));
        assertThat(NumberNormalizer.normalize("-7")).isNotEqualTo(NumberNormalizer.normalize("7"));
    }

    @Test
    void normalize_treatsNegativeZeroRealAsZero() {
        assertThat(NumberNormalizer.normalize("-0.0")).isEqualTo(NumberNormalizer.normalize("0."));
        assertThat(NumberNormalizer.normalize("0.0E5")).isEqualTo(NumberNormalizer.normalize("0."));
    }

    @Test
    void normalize_neverRoundsDistinctValues() {
        assertThat(NumberNormalizer.normalize("1.0000000001"))
                .isNotEqualTo(NumberNormalizer.normalize("1.0000000002"));
        assertThat(NumberNormalizer.normalize("1.5E-3")).isEqualTo(NumberNormalizer.normalize("0.0015"));
        assertThat(NumberNormalizer.normalize("-2.5")).isNotEqualTo(NumberNormalizer.normalize("2.5"));
    }
}
