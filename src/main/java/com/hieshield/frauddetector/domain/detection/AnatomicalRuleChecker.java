package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags procedure categories claimed more often than a human body allows.
 * One violation per offending category, however far over the limit it is.
 */
public class AnatomicalRuleChecker implements ViolationDetector {

    private final AnatomicalLimits limits;

    public AnatomicalRuleChecker(AnatomicalLimits limits) {
        this.limits = limits;
    }

    @Override
    public List<Violation> detect(List<ClassifiedClaim> claims) {
        // first-seen order of categories drives violation order
        Map<ProcedureCategory, Integer> counts = new LinkedHashMap<>();
        for (ClassifiedClaim claim : claims) {
            claim.getCategory().ifPresent(c -> counts.merge(c, 1, Integer::sum));
        }

        List<Violation> violations = new ArrayList<>();
        counts.forEach((category, count) -> limits.limitFor(category)
                .filter(limit -> count > limit)
                .ifPresent(limit -> violations.add(Violation.anatomical(category, count, limit))));
        return violations;
    }

    public AnatomicalLimits getLimits() {
        return limits;
    }
}
