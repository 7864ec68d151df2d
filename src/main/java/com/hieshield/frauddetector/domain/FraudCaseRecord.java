package com.hieshield.frauddetector.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A suspicious analysis kept for human review.
 */
public class FraudCaseRecord {

    private final UUID id;
    private final String patientId;
    private final FraudType fraudType;
    private final double fraudScore;
    private final RiskLevel riskLevel;
    private final BigDecimal totalAmount;
    private final int procedureCount;
    private final int hospitalCount;
    private final List<Violation> violations;
    private final List<ProcedureClaim> claims;
    private final OffsetDateTime createdAt;
    private final boolean reviewed;
    private final String reviewer;
    private final String reviewNotes;
    private final CaseStatus status;

    public FraudCaseRecord(UUID id, String patientId, FraudType fraudType, double fraudScore, RiskLevel riskLevel,
                           BigDecimal totalAmount, int procedureCount, int hospitalCount,
                           List<Violation> violations, List<ProcedureClaim> claims, OffsetDateTime createdAt,
                           boolean reviewed, String reviewer, String reviewNotes, CaseStatus status) {
        this.id = id;
        this.patientId = patientId;
        this.fraudType = fraudType;
        this.fraudScore = fraudScore;
        this.riskLevel = riskLevel;
        this.totalAmount = totalAmount;
        this.procedureCount = procedureCount;
        this.hospitalCount = hospitalCount;
        this.violations = List.copyOf(violations);
        this.claims = List.copyOf(claims);
        this.createdAt = createdAt;
        this.reviewed = reviewed;
        this.reviewer = reviewer;
        this.reviewNotes = reviewNotes;
        this.status = status;
    }

    /** New, unreviewed case for an analysis of the given claims. */
    public static FraudCaseRecord open(UUID id, FraudAnalysisResult result, List<ProcedureClaim> claims) {
        return new FraudCaseRecord(id, result.getPatientId(), result.getFraudType(), result.getFraudScore(),
                result.getRiskLevel(), result.getTotalAmount(), result.getProcedureCount(),
                result.getHospitalCount(), result.getViolations(), claims, result.getAnalysisTimestamp(),
                false, null, null, CaseStatus.PENDING);
    }

    public FraudCaseRecord withReview(String reviewer, String reviewNotes, CaseStatus status) {
        return new FraudCaseRecord(id, patientId, fraudType, fraudScore, riskLevel, totalAmount, procedureCount,
                hospitalCount, violations, claims, createdAt, true, reviewer, reviewNotes, status);
    }

    public UUID getId() { return id; }

    public String getPatientId() { return patientId; }

    public FraudType getFraudType() { return fraudType; }

    public double getFraudScore() { return fraudScore; }

    public RiskLevel getRiskLevel() { return riskLevel; }

    public BigDecimal getTotalAmount() { return totalAmount; }

    public int getProcedureCount() { return procedureCount; }

    public int getHospitalCount() { return hospitalCount; }

    public List<Violation> getViolations() { return violations; }

    public List<ProcedureClaim> getClaims() { return claims; }

    public OffsetDateTime getCreatedAt() { return createdAt; }

    public boolean isReviewed() { return reviewed; }

    public String getReviewer() { return reviewer; }

    public String getReviewNotes() { return reviewNotes; }

    public CaseStatus getStatus() { return status; }
}
