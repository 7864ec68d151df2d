package com.hieshield.frauddetector.application;

import com.hieshield.frauddetector.config.AppProperties;
import com.hieshield.frauddetector.domain.FraudAnalysisResult;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.detection.FraudDetectionEngine;
import com.hieshield.frauddetector.domain.ports.AuditTrailPort;
import com.hieshield.frauddetector.domain.ports.FraudCaseRepository;
import com.hieshield.frauddetector.domain.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class FraudAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FraudAnalysisService.class);

    static final String AUDIT_ACTION = "ANALYZE_FRAUD_PROCEDURES";
    static final String AUDIT_RESOURCE = "FRAUD";

    private final FraudDetectionEngine engine;
    private final FraudCaseRepository cases;
    private final NotifierPort notifier;
    private final AuditTrailPort audit;
    private final double persistThreshold;

    public FraudAnalysisService(FraudDetectionEngine engine, FraudCaseRepository cases, NotifierPort notifier,
                                AuditTrailPort audit, AppProperties properties) {
        this.engine = engine;
        this.cases = cases;
        this.notifier = notifier;
        this.audit = audit;
        this.persistThreshold = properties.getFraud().getPersistThreshold();
    }

    @Transactional
    public AnalysisOutcome analyze(AnalyzeProceduresCommand cmd) {
        log.info("Starting procedure fraud analysis - patientId: {}, procedures: {}, requestedBy: {}",
                cmd.patientId, cmd.procedures.size(), cmd.requestedBy);

        AnalysisOutcome outcome;
        try {
            outcome = analyzeAndStore(cmd);
        } catch (RuntimeException e) {
            log.error("Fraud analysis failed for patient {}: {}", cmd.patientId, e.getMessage());
            audit.record(cmd.requestedBy, AUDIT_ACTION, AUDIT_RESOURCE, cmd.patientId, "FAILURE");
            throw e;
        }

        audit.record(cmd.requestedBy, AUDIT_ACTION, AUDIT_RESOURCE, cmd.patientId, "SUCCESS");
        return outcome;
    }

    /** Audits a request the web layer refused before any analysis ran. */
    public void recordRejected(String requestedBy, String patientId) {
        audit.record(requestedBy, AUDIT_ACTION, AUDIT_RESOURCE, patientId, "FAILURE");
    }

    private AnalysisOutcome analyzeAndStore(AnalyzeProceduresCommand cmd) {
        FraudAnalysisResult result = engine.analyze(cmd.patientId, cmd.procedures);

        log.info("Fraud analysis result - patientId: {}, score: {}, riskLevel: {}, violations: {}",
                cmd.patientId, result.getFraudScore(), result.getRiskLevel(), result.getViolations());

        UUID caseId = null;
        if (result.getFraudScore() > persistThreshold) {
            FraudCaseRecord record = cases.save(FraudCaseRecord.open(UUID.randomUUID(), result, cmd.procedures));
            caseId = record.getId();
            log.warn("FRAUD SUSPECTED - Risk Level: {} (Score: {}) - Case {} stored for patient {}",
                    result.getRiskLevel(), result.getFraudScore(), caseId, cmd.patientId);

            try {
                notifier.sendCaseFlagged(cmd.patientId, caseId, notificationPayload(result));
            } catch (Exception e) {
                // case is stored; reviewers still find it through the case list
                log.error("Failed to send notification for case {}: {}", caseId, e.getMessage(), e);
            }
        } else {
            log.info("Score {} not above storage threshold {} - nothing stored for patient {}",
                    result.getFraudScore(), persistThreshold, cmd.patientId);
        }
        return new AnalysisOutcome(result, caseId);
    }

    private Map<String, Object> notificationPayload(FraudAnalysisResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("fraudScore", result.getFraudScore());
        payload.put("riskLevel", result.getRiskLevel().name());
        payload.put("fraudType", result.getFraudType().getCode());
        payload.put("totalAmount", result.getTotalAmount().toPlainString());
        payload.put("procedureCount", result.getProcedureCount());
        payload.put("hospitalCount", result.getHospitalCount());

        List<String> rules = result.getViolations().stream()
                .map(Violation::getRule)
                .toList();
        payload.put("flaggedRules", rules);
        return payload;
    }

    /** @param caseId id of the stored case, or null when the score did not warrant storage */
    public record AnalysisOutcome(FraudAnalysisResult result, UUID caseId) {}
}
