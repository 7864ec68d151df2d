package com.hieshield.frauddetector.infrastructure.audit;

import com.hieshield.frauddetector.domain.ports.AuditTrailPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit entries to the dedicated {@code AUDIT} logger so they can be
 * routed to their own appender.
 */
@Component
public class LoggingAuditTrail implements AuditTrailPort {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    @Override
    public void record(String actor, String action, String resourceType, String resourceId, String outcome) {
        audit.info("actor={} action={} resource={}:{} outcome={}",
                actor != null ? actor : "anonymous", action, resourceType,
                resourceId != null ? resourceId : "-", outcome);
    }
}
