package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationEvidence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hieshield.frauddetector.domain.ClaimFixtures.claim;
import static org.assertj.core.api.Assertions.assertThat;

class EvidenceExplainerTest {

    private final EvidenceExplainer explainer = new EvidenceExplainer(new ProcedureClassifier());

    private final List<ProcedureClaim> claims = List.of(
            claim("Left leg amputation", "St. Mary", "2025-03-01", "5000", "BlueCross", "John Doe"),
            claim("Appendectomy", "General", "2025-01-15", "800", null, "Jon Doe"),
            claim("Right leg amputation", "City Clinic", "2025-02-01", "5200", "Aetna", null));

    @Test
    void shouldExplainAnatomicalViolationWithMatchingClaimsOnly() {
        Violation v = Violation.anatomical(ProcedureCategory.LEG_AMPUTATION, 2, 1);

        ViolationEvidence explained = explainer.explain(v, claims);

        assertThat(explained.getViolation()).isSameAs(v);
        assertThat(explained.getExplanation()).isEqualTo(
                "This anomaly indicates the patient has claimed more leg amputation procedures (2) than a human "
                        + "body typically possesses (1). This is a critical red flag for potential fraud.");
        assertThat(explained.getEvidence()).containsExactly(
                "Procedures claimed: Left leg amputation on 2025-03-01; Right leg amputation on 2025-02-01");
    }

    @Test
    void shouldListHospitalsAndFlattenClaims() {
        Violation v = Violation.crossProvider(List.of("St. Mary", "General", "City Clinic"));

        List<String> evidence = explainer.explain(v, claims).getEvidence();

        assertThat(evidence).containsExactly(
                "Hospitals involved: St. Mary, General, City Clinic",
                "Claims: Left leg amputation at St. Mary on 2025-03-01; Appendectomy at General on 2025-01-15; "
                        + "Right leg amputation at City Clinic on 2025-02-01");
    }

    @Test
    void shouldPrintUnknownForMissingInsurerAndName() {
        List<String> insurance = explainer.explain(Violation.insuranceFraud(List.of("BlueCross", "Aetna")), claims)
                .getEvidence();
        List<String> identity = explainer.explain(Violation.identityReuse(List.of("john doe", "jon doe")), claims)
                .getEvidence();

        assertThat(insurance.get(0)).isEqualTo("Insurance providers involved: BlueCross, Aetna");
        assertThat(insurance.get(1)).contains("Appendectomy to unknown on 2025-01-15");
        assertThat(identity.get(0)).isEqualTo("Name variations used: john doe, jon doe");
        assertThat(identity.get(1)).contains("Patient: unknown, Procedure: Right leg amputation on 2025-02-01");
    }

    @Test
    void shouldListClaimDatesInOrderForTemporalAnomaly() {
        ViolationEvidence explained = explainer.explain(Violation.temporalAnomaly(3, 7), claims);

        assertThat(explained.getExplanation()).contains("(Major procedures only 3 days apart)");
        assertThat(explained.getEvidence())
                .containsExactly("Dates of relevant procedures: 2025-01-15, 2025-02-01, 2025-03-01");
    }

    @Test
    void shouldExplainEveryViolationInOrder() {
        List<Violation> violations = List.of(
                Violation.temporalAnomaly(1, 7),
                Violation.anatomical(ProcedureCategory.LEG_AMPUTATION, 2, 1));

        assertThat(explainer.explainAll(violations, claims))
                .extracting(ViolationEvidence::getViolation)
                .containsExactlyElementsOf(violations);
    }
}
