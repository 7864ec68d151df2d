package com.hieshield.frauddetector.domain;

public enum ViolationType {
    ANATOMICAL_VIOLATION("anatomical_violation"),
    CROSS_PROVIDER_PATTERN("cross_provider_pattern"),
    INSURANCE_FRAUD("insurance_fraud"),
    IDENTITY_REUSE("identity_reuse"),
    TEMPORAL_ANOMALY("temporal_anomaly");

    private final String tag;

    ViolationType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static ViolationType fromTag(String tag) {
        for (ViolationType t : values()) {
            if (t.tag.equals(tag)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown violation type: " + tag);
    }
}
