package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.RiskLevel;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @ParameterizedTest
    @CsvSource({
            "0.0, LOW",
            "0.29, LOW",
            "0.3, MEDIUM",
            "0.59, MEDIUM",
            "0.6, HIGH",
            "0.79, HIGH",
            "0.8, CRITICAL",
            "1.0, CRITICAL"
    })
    void shouldMapScoreToTierInclusiveAtLowerBound(double score, RiskLevel expected) {
        assertThat(classifier.classify(score)).isEqualTo(expected);
    }
}
