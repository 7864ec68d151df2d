package com.hieshield.frauddetector.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decision a reviewer takes on a stored case, and the status it leads to.
 */
public enum ReviewAction {
    APPROVE("approve", CaseStatus.FALSE_POSITIVE),
    FLAG("flag", CaseStatus.CONFIRMED_FRAUD),
    INVESTIGATE("investigate", CaseStatus.UNDER_INVESTIGATION);

    private final String code;
    private final CaseStatus resultingStatus;

    ReviewAction(String code, CaseStatus resultingStatus) {
        this.code = code;
        this.resultingStatus = resultingStatus;
    }

    public String getCode() {
        return code;
    }

    public CaseStatus getResultingStatus() {
        return resultingStatus;
    }

    public static Optional<ReviewAction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
