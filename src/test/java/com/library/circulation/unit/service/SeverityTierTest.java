package com.library.circulation.unit.service;

import com.library.circulation.service.SeverityTier;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTierTest {

    @ParameterizedTest
    @CsvSource({
        "3, 0, HIGH",
        "1, 14, HIGH",
        "5, 30, HIGH",
        "2, 0, MEDIUM",
        "1, 7, MEDIUM",
        "2, 13, MEDIUM",
        "1, 0, LOW",
        "1, 6, LOW"
    })
    void classify_picksFirstMatchingTier(long count, long maxDays, SeverityTier expected) {
        assertThat(SeverityTier.classify(count, maxDays)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"HIGH, 21", "MEDIUM, 14", "LOW, 7"})
    void blacklistDuration_matchesTier(SeverityTier tier, long days) {
        assertThat(tier.blacklistDuration()).isEqualTo(Duration.ofDays(days));
    }
}
