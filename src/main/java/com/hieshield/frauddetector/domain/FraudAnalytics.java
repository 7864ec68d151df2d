package com.hieshield.frauddetector.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Stored fraud cases grouped four ways: per creation day, per fraud type,
 * per risk level and per number of hospitals involved.
 */
public record FraudAnalytics(List<DailyTrend> fraudTrend,
                             List<TypeCount> fraudTypes,
                             List<RiskLevelCount> riskLevels,
                             List<HospitalPattern> hospitalPatterns) {

    public FraudAnalytics {
        fraudTrend = List.copyOf(fraudTrend);
        fraudTypes = List.copyOf(fraudTypes);
        riskLevels = List.copyOf(riskLevels);
        hospitalPatterns = List.copyOf(hospitalPatterns);
    }

    public record DailyTrend(LocalDate date, long fraudCount, double avgConfidence, BigDecimal totalAmount) {}

    public record TypeCount(String type, long count, BigDecimal totalAmount) {}

    public record RiskLevelCount(RiskLevel level, long count, double avgConfidence) {}

    public record HospitalPattern(int hospitalCount, long caseCount, double avgConfidence, BigDecimal totalAmount) {}
}
