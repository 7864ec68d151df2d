package com.hieshield.frauddetector.domain;

import java.util.List;

public enum FraudType {
    ANATOMICAL_IMPOSSIBILITY("anatomical_impossibility"),
    CROSS_PROVIDER_FRAUD("cross_provider_fraud"),
    INSURANCE_FRAUD("insurance_fraud"),
    SUSPICIOUS_ACTIVITY("suspicious_activity");

    private final String code;

    FraudType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Headline fraud type for a set of violations, by precedence
     * anatomical, cross-provider, insurance, then the catch-all.
     */
    public static FraudType of(List<Violation> violations) {
        if (contains(violations, ViolationType.ANATOMICAL_VIOLATION)) {
            return ANATOMICAL_IMPOSSIBILITY;
        }
        if (contains(violations, ViolationType.CROSS_PROVIDER_PATTERN)) {
            return CROSS_PROVIDER_FRAUD;
        }
        if (contains(violations, ViolationType.INSURANCE_FRAUD)) {
            return INSURANCE_FRAUD;
        }
        return SUSPICIOUS_ACTIVITY;
    }

    public static FraudType fromCode(String code) {
        for (FraudType t : values()) {
            if (t.code.equals(code)) {
                return t;
            }
        }
        return SUSPICIOUS_ACTIVITY;
    }

    private static boolean contains(List<Violation> violations, ViolationType type) {
        return violations.stream().anyMatch(v -> v.getType() == type);
    }
}
