package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hieshield.frauddetector.application.FraudAnalyticsService.AnalyticsReport;
import com.hieshield.frauddetector.domain.FraudAnalytics;

import java.math.BigDecimal;
import java.util.List;

public record FraudAnalyticsResponse(
        @JsonProperty("fraud_trend") List<TrendPoint> fraudTrend,
        @JsonProperty("fraud_types") List<TypeSlice> fraudTypes,
        @JsonProperty("risk_levels") List<RiskSlice> riskLevels,
        @JsonProperty("hospital_patterns") List<HospitalSlice> hospitalPatterns,
        @JsonProperty("generated_at") String generatedAt) {

    public static FraudAnalyticsResponse from(AnalyticsReport report) {
        FraudAnalytics a = report.analytics();
        return new FraudAnalyticsResponse(
                a.fraudTrend().stream()
                        .map(t -> new TrendPoint(t.date().toString(), t.fraudCount(), t.avgConfidence(),
                                t.totalAmount()))
                        .toList(),
                a.fraudTypes().stream()
                        .map(t -> new TypeSlice(t.type(), t.count(), t.totalAmount()))
                        .toList(),
                a.riskLevels().stream()
                        .map(r -> new RiskSlice(r.level().name(), r.count(), r.avgConfidence()))
                        .toList(),
                a.hospitalPatterns().stream()
                        .map(h -> new HospitalSlice(h.hospitalCount(), h.caseCount(), h.avgConfidence(),
                                h.totalAmount()))
                        .toList(),
                report.generatedAt().toString());
    }

    public record TrendPoint(
            String date,
            @JsonProperty("fraud_count") long fraudCount,
            @JsonProperty("avg_confidence") double avgConfidence,
            @JsonProperty("total_amount") BigDecimal totalAmount) {}

    public record TypeSlice(
            String type,
            long count,
            @JsonProperty("total_amount") BigDecimal totalAmount) {}

    public record RiskSlice(
            String level,
            long count,
            @JsonProperty("avg_confidence") double avgConfidence) {}

    public record HospitalSlice(
            @JsonProperty("hospital_count") int hospitalCount,
            @JsonProperty("case_count") long caseCount,
            @JsonProperty("avg_confidence") double avgConfidence,
            @JsonProperty("total_amount") BigDecimal totalAmount) {}
}
