package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maximum number of times a procedure category is physically possible for one person.
 * Categories without an entry are unlimited.
 */
public class AnatomicalLimits {

    private final Map<ProcedureCategory, Integer> limits;

    public AnatomicalLimits(Map<ProcedureCategory, Integer> limits) {
        EnumMap<ProcedureCategory, Integer> copy = new EnumMap<>(ProcedureCategory.class);
        limits.forEach((category, limit) -> {
            if (limit == null || limit < 0) {
                throw new IllegalArgumentException("Invalid anatomical limit for " + category.getKey() + ": " + limit);
            }
            copy.put(category, limit);
        });
        this.limits = Collections.unmodifiableMap(copy);
    }

    public static AnatomicalLimits defaults() {
        Map<ProcedureCategory, Integer> m = new EnumMap<>(ProcedureCategory.class);
        m.put(ProcedureCategory.LEG_AMPUTATION, 2);
        m.put(ProcedureCategory.ARM_AMPUTATION, 2);
        m.put(ProcedureCategory.HEART_SURGERY, 1);
        m.put(ProcedureCategory.BRAIN_SURGERY, 1);
        m.put(ProcedureCategory.KIDNEY_TRANSPLANT, 2);
        m.put(ProcedureCategory.LIVER_TRANSPLANT, 1);
        return new AnatomicalLimits(m);
    }

    public Optional<Integer> limitFor(ProcedureCategory category) {
        return Optional.ofNullable(limits.get(category));
    }

    public Map<ProcedureCategory, Integer> asMap() {
        return limits;
    }
}
