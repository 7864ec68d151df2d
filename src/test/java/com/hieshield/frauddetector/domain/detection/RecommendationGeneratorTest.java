package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.Violation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();

    @Test
    void shouldReturnNothingForCleanLowScore() {
        assertThat(generator.recommend(List.of(), 0.0)).isEmpty();
    }

    @Test
    void shouldStartWithTierBlockThenTypeBlock() {
        Violation anatomical = Violation.anatomical(ProcedureCategory.LEG_AMPUTATION, 3, 2);

        List<String> recommendations = generator.recommend(List.of(anatomical), 0.4);

        List<String> expected = new ArrayList<>(RecommendationGenerator.MEDIUM_TIER);
        expected.add("Implement anatomical constraint validation in claims processing");
        expected.add("Review patient's historical medical records for discrepancies");
        assertThat(recommendations).containsExactlyElementsOf(expected);
    }

    @Test
    void shouldAddTypeBlockOnceInFirstSeenOrder() {
        List<Violation> violations = List.of(
                Violation.temporalAnomaly(1, 7),
                Violation.identityReuse(List.of("john doe", "jon doe")),
                Violation.temporalAnomaly(2, 7));

        List<String> recommendations = generator.recommend(violations, 0.55);

        assertThat(recommendations).containsExactly(
                "Enhanced monitoring of future claims",
                "Verify medical necessity with treating physicians",
                "Establish rules for minimum time intervals between certain procedures",
                "Automate alerts for unusually frequent claims",
                "Strengthen patient identity verification processes (e.g., biometrics, multi-factor authentication)",
                "Implement robust alias detection mechanisms");
        assertThat(recommendations).doesNotHaveDuplicates();
    }

    @Test
    void shouldPickTierByScore() {
        assertThat(generator.recommend(List.of(), 0.8)).containsExactlyElementsOf(RecommendationGenerator.CRITICAL_TIER);
        assertThat(generator.recommend(List.of(), 0.6)).containsExactlyElementsOf(RecommendationGenerator.HIGH_TIER);
        assertThat(generator.recommend(List.of(), 0.3)).containsExactlyElementsOf(RecommendationGenerator.MEDIUM_TIER);
        assertThat(generator.recommend(List.of(), 0.29)).isEmpty();
    }

    @Test
    void shouldGuideInsuranceFraud() {
        List<String> recommendations = generator.recommend(
                List.of(Violation.insuranceFraud(List.of("BlueCross", "Aetna"))), 0.25);

        assertThat(recommendations)
                .containsExactly("Coordinate claim verification with all involved insurance providers");
    }
}
