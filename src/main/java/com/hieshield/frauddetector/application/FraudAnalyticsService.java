package com.hieshield.frauddetector.application;

import com.hieshield.frauddetector.domain.FraudAnalytics;
import com.hieshield.frauddetector.domain.ports.AuditTrailPort;
import com.hieshield.frauddetector.domain.ports.FraudCaseRepository;
import com.hieshield.frauddetector.exception.ClaimValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Service
public class FraudAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(FraudAnalyticsService.class);

    static final int TREND_DAYS = 30;

    private final FraudCaseRepository cases;
    private final AuditTrailPort audit;
    private final Clock clock;

    public FraudAnalyticsService(FraudCaseRepository cases, AuditTrailPort audit, Clock clock) {
        this.cases = cases;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Chart data over stored cases. Both dates are optional and inclusive, in UTC days.
     */
    @Transactional(readOnly = true)
    public AnalyticsReport charts(LocalDate startDate, LocalDate endDate) {
        String user = currentUser();
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            audit.record(user, "VIEW_FRAUD_ANALYTICS", "FRAUD", null, "FAILURE");
            throw new ClaimValidationException("startDate", "startDate must not be after endDate");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime from = startDate == null ? null : startDate.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime to = endDate == null ? null : endDate.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime trendSince = now.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate()
                .minusDays(TREND_DAYS).atStartOfDay().atOffset(ZoneOffset.UTC);

        log.info("Building fraud analytics - from: {}, to: {}, trendSince: {}, requestedBy: {}",
                from, to, trendSince, user);

        FraudAnalytics analytics;
        try {
            analytics = cases.analytics(from, to, trendSince);
        } catch (RuntimeException e) {
            audit.record(user, "VIEW_FRAUD_ANALYTICS", "FRAUD", null, "FAILURE");
            throw e;
        }

        audit.record(user, "VIEW_FRAUD_ANALYTICS", "FRAUD", null, "SUCCESS");
        return new AnalyticsReport(analytics, now);
    }

    private static String currentUser() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null ? auth.getName() : "system";
    }

    public record AnalyticsReport(FraudAnalytics analytics, OffsetDateTime generatedAt) {}
}
