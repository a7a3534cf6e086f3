package com.ztverify.riskauth.domain.risk;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceSimilarityTest {

    @Test
    void shouldMatchDifflibRatios() {
        assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isCloseTo(0.75, within(1e-9));
        assertThat(SequenceSimilarity.ratio("abcd", "abce")).isCloseTo(0.75, within(1e-9));
        assertThat(SequenceSimilarity.ratio("abxcd", "abcd")).isCloseTo(8.0 / 9.0, within(1e-9));
    }

    @Test
    void shouldHandleEmptyAndIdenticalInputs() {
        assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio(null, null)).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("fp-123", "")).isZero();
        assertThat(SequenceSimilarity.ratio("fp-123", "fp-123")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "xyz")).isZero();
    }

    @Test
    void shouldBeBoundedForLongFingerprints() {
        String a = "Mozilla/5.0|1920x1080|Europe/Berlin|de-DE|".repeat(20);
        String b = "Mozilla/5.0|1366x768|Asia/Dubai|ar-AE|".repeat(20);

        assertThat(SequenceSimilarity.ratio(a, b)).isBetween(0.0, 1.0);
    }
}
