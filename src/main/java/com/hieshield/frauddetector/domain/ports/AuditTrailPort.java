package com.hieshield.frauddetector.domain.ports;

/**
 * Records who did what to which resource, and how it ended.
 */
public interface AuditTrailPort {

    void record(String actor, String action, String resourceType, String resourceId, String outcome);
}
