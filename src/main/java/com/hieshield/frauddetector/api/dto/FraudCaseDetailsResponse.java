package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hieshield.frauddetector.application.FraudCaseService.FraudCaseDetails;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.ProcedureClaim;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Stored case as shown to a reviewer: the case itself, its financial impact,
 * the claims in date order and every violation with its evidence.
 */
public record FraudCaseDetailsResponse(
        UUID id,
        @JsonProperty("patient_id") String patientId,
        @JsonProperty("fraud_type") String fraudType,
        @JsonProperty("fraud_score") double fraudScore,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("financial_impact") FinancialImpact financialImpact,
        List<TimelineEntry> timeline,
        List<ViolationResponse> violations,
        @JsonProperty("created_at") String createdAt,
        boolean reviewed,
        String reviewer,
        @JsonProperty("review_notes") String reviewNotes,
        String status) {

    public record FinancialImpact(
            @JsonProperty("total_amount") BigDecimal totalAmount,
            @JsonProperty("procedure_count") int procedureCount,
            @JsonProperty("hospital_count") int hospitalCount,
            @JsonProperty("average_per_procedure") BigDecimal averagePerProcedure) {}

    public record TimelineEntry(
            String date,
            String procedure,
            @JsonProperty("procedure_code") String procedureCode,
            String hospital,
            BigDecimal amount,
            @JsonProperty("insurance_provider") String insuranceProvider,
            @JsonProperty("patient_name") String patientName) {

        static TimelineEntry from(ProcedureClaim c) {
            return new TimelineEntry(c.getDate() == null ? null : c.getDate().toString(),
                    c.getProcedureName(), c.getProcedureCode(), c.getHospital(), c.getAmount(),
                    c.getInsuranceProvider(), c.getPatientName());
        }
    }

    public static FraudCaseDetailsResponse from(FraudCaseDetails details) {
        FraudCaseRecord c = details.record();
        return new FraudCaseDetailsResponse(
                c.getId(),
                c.getPatientId(),
                c.getFraudType().getCode(),
                c.getFraudScore(),
                c.getRiskLevel().name(),
                new FinancialImpact(c.getTotalAmount(), c.getProcedureCount(), c.getHospitalCount(),
                        details.averagePerProcedure()),
                details.timeline().stream().map(TimelineEntry::from).toList(),
                details.anomalies().stream().map(ViolationResponse::from).toList(),
                c.getCreatedAt() == null ? null : c.getCreatedAt().toString(),
                c.isReviewed(),
                c.getReviewer(),
                c.getReviewNotes(),
                c.getStatus().getCode());
    }
}
