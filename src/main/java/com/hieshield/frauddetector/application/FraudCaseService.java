package com.hieshield.frauddetector.application;

import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.ReviewAction;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.domain.ViolationEvidence;
import com.hieshield.frauddetector.domain.detection.EvidenceExplainer;
import com.hieshield.frauddetector.domain.detection.FraudDetectionEngine;
import com.hieshield.frauddetector.domain.ports.AuditTrailPort;
import com.hieshield.frauddetector.domain.ports.FraudCaseRepository;
import com.hieshield.frauddetector.exception.FraudCaseNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
public class FraudCaseService {

    private static final Logger log = LoggerFactory.getLogger(FraudCaseService.class);

    private final FraudCaseRepository cases;
    private final EvidenceExplainer explainer;
    private final AuditTrailPort audit;

    public FraudCaseService(FraudCaseRepository cases, FraudDetectionEngine engine, AuditTrailPort audit) {
        this.cases = cases;
        this.explainer = engine.getEvidenceExplainer();
        this.audit = audit;
    }

    @Transactional(readOnly = true)
    public CasePage list(RiskLevel riskLevel, Boolean reviewed, int page, int size) {
        log.info("Listing fraud cases - riskLevel: {}, reviewed: {}, page: {}, size: {}",
                riskLevel, reviewed, page, size);
        String user = currentUser();
        try {
            List<FraudCaseRecord> items = cases.list(riskLevel, reviewed, page, size);
            long total = cases.count(riskLevel, reviewed);
            audit.record(user, "VIEW_FRAUD_CASES", "FRAUD", null, "SUCCESS");
            return new CasePage(items, page, size, total);
        } catch (RuntimeException e) {
            audit.record(user, "VIEW_FRAUD_CASES", "FRAUD", null, "FAILURE");
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public FraudCaseDetails details(UUID caseId) {
        log.info("Loading fraud case details - caseId: {}", caseId);
        String user = currentUser();
        FraudCaseDetails details;
        try {
            FraudCaseRecord c = find(caseId);

            List<ViolationEvidence> anomalies = explainer.explainAll(c.getViolations(), c.getClaims());
            List<ProcedureClaim> timeline = c.getClaims().stream()
                    .sorted(Comparator.comparing(ProcedureClaim::getDate,
                            Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())))
                    .toList();
            details = new FraudCaseDetails(c, anomalies, timeline, averagePerProcedure(c));
        } catch (RuntimeException e) {
            audit.record(user, "VIEW_FRAUD_CASE_DETAILS", "FRAUD", caseId.toString(), "FAILURE");
            throw e;
        }

        audit.record(user, "VIEW_FRAUD_CASE_DETAILS", "FRAUD", caseId.toString(), "SUCCESS");
        return details;
    }

    @Transactional
    public FraudCaseRecord review(UUID caseId, ReviewAction action, String notes) {
        String reviewer = currentUser();
        log.info("Reviewing fraud case - caseId: {}, action: {}, reviewer: {}", caseId, action, reviewer);

        FraudCaseRecord updated;
        try {
            FraudCaseRecord c = find(caseId);
            if (c.isReviewed()) {
                log.info("Case {} was already reviewed by {} ({}), overwriting",
                        caseId, c.getReviewer(), c.getStatus());
            }
            updated = cases.save(c.withReview(reviewer, notes, action.getResultingStatus()));
        } catch (RuntimeException e) {
            audit.record(reviewer, "REVIEW_FRAUD_CASE", "FRAUD", caseId.toString(), "FAILURE");
            throw e;
        }
        log.info("Case {} status updated to {}", caseId, updated.getStatus());

        audit.record(reviewer, "REVIEW_FRAUD_CASE", "FRAUD", caseId.toString(), action.getCode());
        return updated;
    }

    private FraudCaseRecord find(UUID caseId) {
        return cases.findById(caseId).orElseThrow(() -> new FraudCaseNotFoundException(caseId));
    }

    private static BigDecimal averagePerProcedure(FraudCaseRecord c) {
        BigDecimal total = c.getTotalAmount() == null ? BigDecimal.ZERO : c.getTotalAmount();
        int divisor = c.getProcedureCount() == 0 ? 1 : c.getProcedureCount();
        return total.divide(BigDecimal.valueOf(divisor), 2, RoundingMode.HALF_UP);
    }

    private static String currentUser() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null ? auth.getName() : "system";
    }

    public record CasePage(List<FraudCaseRecord> items, int page, int size, long total) {
        public long pages() {
            return size == 0 ? 0 : (total + size - 1) / size;
        }
    }

    public record FraudCaseDetails(FraudCaseRecord record, List<ViolationEvidence> anomalies,
                                   List<ProcedureClaim> timeline, BigDecimal averagePerProcedure) {}
}
