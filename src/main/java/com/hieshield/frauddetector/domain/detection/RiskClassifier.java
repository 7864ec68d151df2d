package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.RiskLevel;

public class RiskClassifier {

    public static final double CRITICAL_THRESHOLD = 0.8;
    public static final double HIGH_THRESHOLD = 0.6;
    public static final double MEDIUM_THRESHOLD = 0.3;

    /** Lower bounds are inclusive. */
    public RiskLevel classify(double fraudScore) {
        if (fraudScore >= CRITICAL_THRESHOLD) {
            return RiskLevel.CRITICAL;
        } else if (fraudScore >= HIGH_THRESHOLD) {
            return RiskLevel.HIGH;
        } else if (fraudScore >= MEDIUM_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
