package com.hieshield.frauddetector.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

public class FraudAnalysisResult {

    private final String patientId;
    private final double fraudScore;
    private final RiskLevel riskLevel;
    private final FraudType fraudType;
    private final List<Violation> violations;
    private final List<ViolationEvidence> evidence;
    private final BigDecimal totalAmount;
    private final int procedureCount;
    private final int hospitalCount;
    private final List<String> recommendations;
    private final OffsetDateTime analysisTimestamp;

    public FraudAnalysisResult(String patientId, double fraudScore, RiskLevel riskLevel, FraudType fraudType,
                               List<Violation> violations, List<ViolationEvidence> evidence,
                               BigDecimal totalAmount, int procedureCount, int hospitalCount,
                               List<String> recommendations, OffsetDateTime analysisTimestamp) {
        this.patientId = patientId;
        this.fraudScore = fraudScore;
        this.riskLevel = riskLevel;
        this.fraudType = fraudType;
        this.violations = List.copyOf(violations);
        this.evidence = List.copyOf(evidence);
        this.totalAmount = totalAmount;
        this.procedureCount = procedureCount;
        this.hospitalCount = hospitalCount;
        this.recommendations = List.copyOf(recommendations);
        this.analysisTimestamp = analysisTimestamp;
    }

    public String getPatientId() {
        return patientId;
    }

    public double getFraudScore() {
        return fraudScore;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public FraudType getFraudType() {
        return fraudType;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<ViolationEvidence> getEvidence() {
        return evidence;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public int getProcedureCount() {
        return procedureCount;
    }

    public int getHospitalCount() {
        return hospitalCount;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public OffsetDateTime getAnalysisTimestamp() {
        return analysisTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FraudAnalysisResult that = (FraudAnalysisResult) o;
        return Double.compare(fraudScore, that.fraudScore) == 0
                && procedureCount == that.procedureCount
                && hospitalCount == that.hospitalCount
                && Objects.equals(patientId, that.patientId)
                && riskLevel == that.riskLevel
                && fraudType == that.fraudType
                && Objects.equals(violations, that.violations)
                && Objects.equals(evidence, that.evidence)
                && Objects.equals(totalAmount, that.totalAmount)
                && Objects.equals(recommendations, that.recommendations)
                && Objects.equals(analysisTimestamp, that.analysisTimestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patientId, fraudScore, riskLevel, fraudType, violations, evidence, totalAmount,
                procedureCount, hospitalCount, recommendations, analysisTimestamp);
    }
}
