package com.hieshield.frauddetector.domain;

public enum CaseStatus {
    PENDING("pending"),
    UNDER_INVESTIGATION("under_investigation"),
    CONFIRMED_FRAUD("confirmed_fraud"),
    FALSE_POSITIVE("false_positive"),
    RESOLVED("resolved");

    private final String code;

    CaseStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static CaseStatus fromCode(String code) {
        for (CaseStatus s : values()) {
            if (s.code.equals(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown case status: " + code);
    }
}
