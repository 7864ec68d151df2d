package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds remediation guidance: the block for the score tier first, then one
 * block per violation type in the order the types first appear. Duplicates
 * are dropped keeping the first occurrence.
 */
public class RecommendationGenerator {

    static final List<String> CRITICAL_TIER = List.of(
            "IMMEDIATE ACTION: Flag patient and block all future claims",
            "Investigate all associated hospitals and providers",
            "Contact law enforcement for potential criminal fraud");

    static final List<String> HIGH_TIER = List.of(
            "Require additional verification for future claims",
            "Manual review of all procedures",
            "Cross-reference with other insurance providers");

    static final List<String> MEDIUM_TIER = List.of(
            "Enhanced monitoring of future claims",
            "Verify medical necessity with treating physicians");

    static final Map<ViolationType, List<String>> BY_TYPE = new EnumMap<>(ViolationType.class);

    static {
        BY_TYPE.put(ViolationType.ANATOMICAL_VIOLATION, List.of(
                "Implement anatomical constraint validation in claims processing",
                "Review patient's historical medical records for discrepancies"));
        BY_TYPE.put(ViolationType.CROSS_PROVIDER_PATTERN, List.of(
                "Enhance data sharing protocols between healthcare providers",
                "Utilize centralized patient registries or EHRs"));
        BY_TYPE.put(ViolationType.INSURANCE_FRAUD, List.of(
                "Coordinate claim verification with all involved insurance providers"));
        BY_TYPE.put(ViolationType.IDENTITY_REUSE, List.of(
                "Strengthen patient identity verification processes (e.g., biometrics, multi-factor authentication)",
                "Implement robust alias detection mechanisms"));
        BY_TYPE.put(ViolationType.TEMPORAL_ANOMALY, List.of(
                "Establish rules for minimum time intervals between certain procedures",
                "Automate alerts for unusually frequent claims"));
    }

    public List<String> recommend(List<Violation> violations, double fraudScore) {
        Set<String> recommendations = new LinkedHashSet<>(tierBlock(fraudScore));
        for (Violation violation : violations) {
            recommendations.addAll(BY_TYPE.getOrDefault(violation.getType(), List.of()));
        }
        return new ArrayList<>(recommendations);
    }

    private static List<String> tierBlock(double fraudScore) {
        if (fraudScore >= RiskClassifier.CRITICAL_THRESHOLD) {
            return CRITICAL_TIER;
        } else if (fraudScore >= RiskClassifier.HIGH_THRESHOLD) {
            return HIGH_TIER;
        } else if (fraudScore >= RiskClassifier.MEDIUM_THRESHOLD) {
            return MEDIUM_TIER;
        }
        return List.of();
    }
}
