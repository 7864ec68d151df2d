package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.ProcedureClaim;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps free-text procedure names to anatomical categories. Rules are tried in
 * table order and the first match wins, so a name matching several rules gets
 * the earliest one.
 */
public class ProcedureClassifier {

    public static final List<ClassificationRule> DEFAULT_RULES = List.of(
            ClassificationRule.phrase("leg amputation", ProcedureCategory.LEG_AMPUTATION),
            ClassificationRule.phrase("arm amputation", ProcedureCategory.ARM_AMPUTATION),
            ClassificationRule.subjectWithAny("heart", ProcedureCategory.HEART_SURGERY, "surgery", "bypass"),
            ClassificationRule.subjectWithAny("brain", ProcedureCategory.BRAIN_SURGERY, "surgery"),
            ClassificationRule.phrase("kidney transplant", ProcedureCategory.KIDNEY_TRANSPLANT),
            ClassificationRule.phrase("liver transplant", ProcedureCategory.LIVER_TRANSPLANT)
    );

    private final List<ClassificationRule> rules;

    public ProcedureClassifier() {
        this(DEFAULT_RULES);
    }

    public ProcedureClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Optional<ProcedureCategory> classify(String procedureName) {
        if (procedureName == null) {
            return Optional.empty();
        }
        String name = procedureName.toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : rules) {
            if (rule.matches(name)) {
                return Optional.of(rule.getCategory());
            }
        }
        return Optional.empty();
    }

    /** Annotates each claim with its category, keeping input order. */
    public List<ClassifiedClaim> classifyAll(List<ProcedureClaim> claims) {
        return claims.stream()
                .map(c -> new ClassifiedClaim(c, classify(c.getProcedureName()).orElse(null)))
                .toList();
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }
}
