package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationEvidence;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns violations into reviewer-facing text: a fixed explanation per
 * violation type plus excerpts of the claims that triggered it.
 */
public class EvidenceExplainer {

    private static final String UNKNOWN = "unknown";

    private final ProcedureClassifier classifier;

    public EvidenceExplainer(ProcedureClassifier classifier) {
        this.classifier = classifier;
    }

    public List<ViolationEvidence> explainAll(List<Violation> violations, List<ProcedureClaim> claims) {
        List<ViolationEvidence> out = new ArrayList<>(violations.size());
        for (Violation v : violations) {
            out.add(explain(v, claims));
        }
        return out;
    }

    public ViolationEvidence explain(Violation violation, List<ProcedureClaim> claims) {
        return new ViolationEvidence(violation, explanation(violation), evidence(violation, claims));
    }

    String explanation(Violation v) {
        return switch (v.getType()) {
            case ANATOMICAL_VIOLATION -> "This anomaly indicates the patient has claimed more "
                    + v.getProcedureType().getLabel() + " procedures (" + v.getCount()
                    + ") than a human body typically possesses (" + v.getLimit()
                    + "). This is a critical red flag for potential fraud.";
            case CROSS_PROVIDER_PATTERN -> "Multiple claims for the same patient were submitted across different "
                    + "hospital systems (" + join(v.getHospitals()) + "). This pattern can indicate an attempt to "
                    + "bypass individual hospital fraud detection systems.";
            case INSURANCE_FRAUD -> "Claims for the same patient were submitted to multiple different insurance "
                    + "providers (" + join(v.getProviders()) + "). This suggests an attempt to exploit loopholes "
                    + "across different insurance policies.";
            case IDENTITY_REUSE -> "The patient ID was used with various name variations (" + join(v.getNames())
                    + "). This is a common tactic in synthetic identity fraud to obscure the true identity of the "
                    + "claimant.";
            case TEMPORAL_ANOMALY -> "Certain procedures were performed in an unusually short time frame ("
                    + v.getDescription() + "). This could indicate unnecessary procedures or an attempt to rapidly "
                    + "process fraudulent claims.";
        };
    }

    List<String> evidence(Violation v, List<ProcedureClaim> claims) {
        return switch (v.getType()) {
            case ANATOMICAL_VIOLATION -> List.of("Procedures claimed: " + claims.stream()
                    .filter(c -> classifier.classify(c.getProcedureName())
                            .map(category -> category == v.getProcedureType())
                            .orElse(false))
                    .map(c -> c.getProcedureName() + " on " + c.getDate())
                    .collect(Collectors.joining("; ")));
            case CROSS_PROVIDER_PATTERN -> List.of(
                    "Hospitals involved: " + join(v.getHospitals()),
                    flatten(claims, c -> c.getProcedureName() + " at " + orUnknown(c.getHospital())
                            + " on " + c.getDate()));
            case INSURANCE_FRAUD -> List.of(
                    "Insurance providers involved: " + join(v.getProviders()),
                    flatten(claims, c -> c.getProcedureName() + " to " + orUnknown(c.getInsuranceProvider())
                            + " on " + c.getDate()));
            case IDENTITY_REUSE -> List.of(
                    "Name variations used: " + join(v.getNames()),
                    flatten(claims, c -> "Patient: " + orUnknown(c.getPatientName())
                            + ", Procedure: " + c.getProcedureName() + " on " + c.getDate()));
            case TEMPORAL_ANOMALY -> List.of("Dates of relevant procedures: " + claims.stream()
                    .map(ProcedureClaim::getDate)
                    .filter(Objects::nonNull)
                    .sorted()
                    .map(LocalDate::toString)
                    .collect(Collectors.joining(", ")));
        };
    }

    private static String flatten(List<ProcedureClaim> claims, Function<ProcedureClaim, String> line) {
        return "Claims: " + claims.stream().map(line).collect(Collectors.joining("; "));
    }

    private static String join(List<String> values) {
        return values == null ? "" : String.join(", ", values);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
