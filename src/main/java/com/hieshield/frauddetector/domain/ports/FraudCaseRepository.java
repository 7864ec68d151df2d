package com.hieshield.frauddetector.domain.ports;

import com.hieshield.frauddetector.domain.FraudAnalytics;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.RiskLevel;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FraudCaseRepository {
    FraudCaseRecord save(FraudCaseRecord caseRecord);

    Optional<FraudCaseRecord> findById(UUID caseId);

    // Highest score first; null filters are ignored
    List<FraudCaseRecord> list(RiskLevel riskLevel, Boolean reviewed, int page, int size);

    long count(RiskLevel riskLevel, Boolean reviewed);

    /**
     * Aggregates cases created in {@code [from, to)}; null bounds are open.
     * The daily trend additionally starts at {@code trendSince}.
     */
    FraudAnalytics analytics(OffsetDateTime from, OffsetDateTime to, OffsetDateTime trendSince);
}
