package com.hieshield.frauddetector.infrastructure.jpa;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "enhanced_fraud_alerts")
public class FraudAlertEntity {
    @Id
    private UUID id;

    @Column(name = "patient_id", nullable = false, length = 50)
    private String patientId;

    @Column(name = "fraud_type", nullable = false, length = 100)
    private String fraudType;

    @Column(name = "fraud_confidence", nullable = false)
    private double fraudConfidence;

    @Column(name = "risk_level", nullable = false, length = 20)
    private String riskLevel;

    @Column(name = "total_amount", precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "procedure_count")
    private int procedureCount;

    @Column(name = "hospital_count")
    private int hospitalCount;

    @Column(name = "anomalies", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String anomaliesJson;

    @Column(name = "procedures", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String proceduresJson;

    @Column(name = "detection_rules", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String detectionRulesJson;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(nullable = false)
    private boolean reviewed;

    @Column(name = "reviewer")
    private String reviewer;

    @Column(name = "review_notes", columnDefinition = "text")
    private String reviewNotes;

    @Column(nullable = false, length = 20)
    private String status;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public String getFraudType() { return fraudType; }
    public void setFraudType(String fraudType) { this.fraudType = fraudType; }

    public double getFraudConfidence() { return fraudConfidence; }
    public void setFraudConfidence(double fraudConfidence) { this.fraudConfidence = fraudConfidence; }

    public String getRiskLevel() { return riskLevel; }
    public void setRiskLevel(String riskLevel) { this.riskLevel = riskLevel; }

    public BigDecimal getTotalAmount() { return totalAmount; }
    public void setTotalAmount(BigDecimal totalAmount) { this.totalAmount = totalAmount; }

    public int getProcedureCount() { return procedureCount; }
    public void setProcedureCount(int procedureCount) { this.procedureCount = procedureCount; }

    public int getHospitalCount() { return hospitalCount; }
    public void setHospitalCount(int hospitalCount) { this.hospitalCount = hospitalCount; }

    public String getAnomaliesJson() { return anomaliesJson; }
    public void setAnomaliesJson(String anomaliesJson) { this.anomaliesJson = anomaliesJson; }

    public String getProceduresJson() { return proceduresJson; }
    public void setProceduresJson(String proceduresJson) { this.proceduresJson = proceduresJson; }

    public String getDetectionRulesJson() { return detectionRulesJson; }
    public void setDetectionRulesJson(String detectionRulesJson) { this.detectionRulesJson = detectionRulesJson; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public boolean isReviewed() { return reviewed; }
    public void setReviewed(boolean reviewed) { this.reviewed = reviewed; }

    public String getReviewer() { return reviewer; }
    public void setReviewer(String reviewer) { this.reviewer = reviewer; }

    public String getReviewNotes() { return reviewNotes; }
    public void setReviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
