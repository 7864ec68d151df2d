package com.hieshield.frauddetector.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hieshield.frauddetector.domain.CaseStatus;
import com.hieshield.frauddetector.domain.FraudAnalytics;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.FraudType;
import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.domain.Severity;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationType;
import com.hieshield.frauddetector.domain.detection.AnatomicalLimits;
import com.hieshield.frauddetector.domain.ports.FraudCaseRepository;
import com.hieshield.frauddetector.infrastructure.jpa.FraudAlertEntity;
import com.hieshield.frauddetector.infrastructure.jpa.SpringFraudAlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores fraud cases in {@code enhanced_fraud_alerts}. Violations, claims and
 * the anatomical limits in force are kept as JSON columns.
 */
@Component
public class JpaFraudCaseRepositoryAdapter implements FraudCaseRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaFraudCaseRepositoryAdapter.class);

    private final SpringFraudAlertRepository alerts;
    private final ObjectMapper objectMapper;
    private final AnatomicalLimits limits;

    public JpaFraudCaseRepositoryAdapter(SpringFraudAlertRepository alerts, ObjectMapper objectMapper,
                                         AnatomicalLimits limits) {
        this.alerts = alerts;
        this.objectMapper = objectMapper;
        this.limits = limits;
    }

    @Override
    public FraudCaseRecord save(FraudCaseRecord c) {
        FraudAlertEntity e = alerts.findById(c.getId()).orElseGet(FraudAlertEntity::new);
        e.setId(c.getId());
        e.setPatientId(c.getPatientId());
        e.setFraudType(c.getFraudType().getCode());
        e.setFraudConfidence(c.getFraudScore());
        e.setRiskLevel(c.getRiskLevel().name());
        e.setTotalAmount(c.getTotalAmount());
        e.setProcedureCount(c.getProcedureCount());
        e.setHospitalCount(c.getHospitalCount());
        e.setAnomaliesJson(write(c.getViolations().stream().map(StoredViolation::of).toList()));
        e.setProceduresJson(write(c.getClaims().stream().map(StoredClaim::of).toList()));
        if (e.getDetectionRulesJson() == null) {
            e.setDetectionRulesJson(write(limitsSnapshot()));
        }
        e.setCreatedAt(c.getCreatedAt());
        e.setReviewed(c.isReviewed());
        e.setReviewer(c.getReviewer());
        e.setReviewNotes(c.getReviewNotes());
        e.setStatus(c.getStatus().getCode());
        alerts.save(e);
        log.debug("Saved fraud case {} for patient {}", c.getId(), c.getPatientId());
        return c;
    }

    @Override
    public Optional<FraudCaseRecord> findById(UUID caseId) {
        return alerts.findById(caseId).map(this::toRecord);
    }

    @Override
    public List<FraudCaseRecord> list(RiskLevel riskLevel, Boolean reviewed, int page, int size) {
        return alerts.search(riskLevel == null ? null : riskLevel.name(), reviewed, PageRequest.of(page, size))
                .stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public long count(RiskLevel riskLevel, Boolean reviewed) {
        return alerts.countMatching(riskLevel == null ? null : riskLevel.name(), reviewed);
    }

    @Override
    public FraudAnalytics analytics(OffsetDateTime from, OffsetDateTime to, OffsetDateTime trendSince) {
        List<FraudAnalytics.DailyTrend> trend = alerts.dailyTrend(trendSince, from, to).stream()
                .map(r -> new FraudAnalytics.DailyTrend(toDate(r[0]), toLong(r[1]), toDouble(r[2]), toAmount(r[3])))
                .toList();
        List<FraudAnalytics.TypeCount> types = alerts.countByFraudType(from, to).stream()
                .map(r -> new FraudAnalytics.TypeCount((String) r[0], toLong(r[1]), toAmount(r[2])))
                .toList();
        List<FraudAnalytics.RiskLevelCount> levels = alerts.countByRiskLevel(from, to).stream()
                .map(r -> new FraudAnalytics.RiskLevelCount(RiskLevel.valueOf((String) r[0]), toLong(r[1]),
                        toDouble(r[2])))
                .toList();
        List<FraudAnalytics.HospitalPattern> hospitals = alerts.countByHospitalCount(from, to).stream()
                .map(r -> new FraudAnalytics.HospitalPattern(((Number) r[0]).intValue(), toLong(r[1]),
                        toDouble(r[2]), toAmount(r[3])))
                .toList();
        log.debug("Aggregated fraud analytics - trend days: {}, types: {}, levels: {}, hospital groups: {}",
                trend.size(), types.size(), levels.size(), hospitals.size());
        return new FraudAnalytics(trend, types, levels, hospitals);
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        return (LocalDate) value;
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static double toDouble(Object value) {
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }

    private static BigDecimal toAmount(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        return value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString());
    }

    private FraudCaseRecord toRecord(FraudAlertEntity e) {
        List<Violation> violations = read(e.getAnomaliesJson(), new TypeReference<List<StoredViolation>>() {})
                .stream().map(StoredViolation::toDomain).toList();
        List<ProcedureClaim> claims = read(e.getProceduresJson(), new TypeReference<List<StoredClaim>>() {})
                .stream().map(StoredClaim::toDomain).toList();
        return new FraudCaseRecord(e.getId(), e.getPatientId(), FraudType.fromCode(e.getFraudType()),
                e.getFraudConfidence(), RiskLevel.valueOf(e.getRiskLevel()), e.getTotalAmount(),
                e.getProcedureCount(), e.getHospitalCount(), violations, claims, e.getCreatedAt(),
                e.isReviewed(), e.getReviewer(), e.getReviewNotes(), CaseStatus.fromCode(e.getStatus()));
    }

    private Map<String, Integer> limitsSnapshot() {
        Map<String, Integer> snapshot = new LinkedHashMap<>();
        limits.asMap().forEach((category, limit) -> snapshot.put(category.getKey(), limit));
        return snapshot;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fraud case column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt fraud case column: " + e.getOriginalMessage(), e);
        }
    }

    record StoredViolation(String type, String severity, String description, String rule,
                           String procedureType, Integer count, Integer limit,
                           List<String> hospitals, List<String> providers, List<String> names, Long gapDays) {

        static StoredViolation of(Violation v) {
            return new StoredViolation(v.getType().getTag(), v.getSeverity().name(), v.getDescription(),
                    v.getRule(), v.getProcedureType() == null ? null : v.getProcedureType().getKey(),
                    v.getCount(), v.getLimit(), v.getHospitals(), v.getProviders(), v.getNames(), v.getGapDays());
        }

        Violation toDomain() {
            return new Violation(ViolationType.fromTag(type), Severity.valueOf(severity), description, rule,
                    ProcedureCategory.fromKey(procedureType).orElse(null), count, limit,
                    hospitals, providers, names, gapDays);
        }
    }

    record StoredClaim(String procedure, String procedureCode, String hospital, String hospitalId,
                       String date, BigDecimal amount, String insuranceProvider, String patientName) {

        static StoredClaim of(ProcedureClaim c) {
            return new StoredClaim(c.getProcedureName(), c.getProcedureCode(), c.getHospital(), c.getHospitalId(),
                    c.getDate() == null ? null : c.getDate().toString(), c.getAmount(),
                    c.getInsuranceProvider(), c.getPatientName());
        }

        ProcedureClaim toDomain() {
            return new ProcedureClaim(procedure, procedureCode, hospital, hospitalId,
                    date == null ? null : LocalDate.parse(date), amount, insuranceProvider, patientName);
        }
    }
}
