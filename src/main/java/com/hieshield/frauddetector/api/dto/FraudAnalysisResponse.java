package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hieshield.frauddetector.domain.FraudAnalysisResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record FraudAnalysisResponse(
        @JsonProperty("patient_id") String patientId,
        @JsonProperty("fraud_score") double fraudScore,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("fraud_type") String fraudType,
        List<ViolationResponse> violations,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("procedure_count") int procedureCount,
        @JsonProperty("hospital_count") int hospitalCount,
        List<String> recommendations,
        @JsonProperty("analysis_timestamp") String analysisTimestamp,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("case_id") UUID caseId) {

    public static FraudAnalysisResponse from(FraudAnalysisResult r, UUID caseId) {
        return new FraudAnalysisResponse(
                r.getPatientId(),
                r.getFraudScore(),
                r.getRiskLevel().name(),
                r.getFraudType().getCode(),
                r.getEvidence().stream().map(ViolationResponse::from).toList(),
                r.getTotalAmount(),
                r.getProcedureCount(),
                r.getHospitalCount(),
                r.getRecommendations(),
                r.getAnalysisTimestamp().toString(),
                caseId);
    }
}
