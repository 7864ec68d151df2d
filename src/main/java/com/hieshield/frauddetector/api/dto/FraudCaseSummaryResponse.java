package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hieshield.frauddetector.domain.FraudCaseRecord;

import java.math.BigDecimal;
import java.util.UUID;

public record FraudCaseSummaryResponse(
        UUID id,
        @JsonProperty("patient_id") String patientId,
        @JsonProperty("fraud_type") String fraudType,
        @JsonProperty("fraud_score") double fraudScore,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("procedure_count") int procedureCount,
        @JsonProperty("hospital_count") int hospitalCount,
        @JsonProperty("violation_count") int violationCount,
        @JsonProperty("created_at") String createdAt,
        boolean reviewed,
        String status) {

    public static FraudCaseSummaryResponse from(FraudCaseRecord c) {
        return new FraudCaseSummaryResponse(
                c.getId(),
                c.getPatientId(),
                c.getFraudType().getCode(),
                c.getFraudScore(),
                c.getRiskLevel().name(),
                c.getTotalAmount(),
                c.getProcedureCount(),
                c.getHospitalCount(),
                c.getViolations().size(),
                c.getCreatedAt() == null ? null : c.getCreatedAt().toString(),
                c.isReviewed(),
                c.getStatus().getCode());
    }
}
