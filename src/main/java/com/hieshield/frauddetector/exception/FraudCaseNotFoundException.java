package com.hieshield.frauddetector.exception;

import java.util.UUID;

public class FraudCaseNotFoundException extends RuntimeException {

    private final UUID caseId;

    public FraudCaseNotFoundException(UUID caseId) {
        super("Fraud case not found: " + caseId);
        this.caseId = caseId;
    }

    public UUID getCaseId() {
        return caseId;
    }
}
