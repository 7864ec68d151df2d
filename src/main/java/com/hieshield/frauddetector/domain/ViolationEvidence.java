package com.hieshield.frauddetector.domain;

import java.util.List;
import java.util.Objects;

/**
 * Plain-language explanation of a violation and the claim excerpts behind it.
 */
public class ViolationEvidence {

    private final Violation violation;
    private final String explanation;
    private final List<String> evidence;

    public ViolationEvidence(Violation violation, String explanation, List<String> evidence) {
        this.violation = violation;
        this.explanation = explanation;
        this.evidence = List.copyOf(evidence);
    }

    public Violation getViolation() {
        return violation;
    }

    public String getExplanation() {
        return explanation;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViolationEvidence that = (ViolationEvidence) o;
        return Objects.equals(violation, that.violation)
                && Objects.equals(explanation, that.explanation)
                && Objects.equals(evidence, that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(violation, explanation, evidence);
    }
}
