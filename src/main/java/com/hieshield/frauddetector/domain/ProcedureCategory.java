package com.hieshield.frauddetector.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ProcedureCategory {
    LEG_AMPUTATION("leg_amputation"),
    ARM_AMPUTATION("arm_amputation"),
    HEART_SURGERY("heart_surgery"),
    BRAIN_SURGERY("brain_surgery"),
    KIDNEY_TRANSPLANT("kidney_transplant"),
    LIVER_TRANSPLANT("liver_transplant");

    private final String key;

    ProcedureCategory(String key) {
        this.key = key;
    }

    /** Machine key used in rules and JSON, e.g. {@code leg_amputation}. */
    public String getKey() {
        return key;
    }

    /** Human wording used in descriptions, e.g. {@code leg amputation}. */
    public String getLabel() {
        return key.replaceFirst("_", " ");
    }

    /**
     * Lenient lookup: {@code leg_amputation}, {@code leg-amputation} and
     * {@code legamputation} all resolve, since config binding may strip separators.
     */
    public static Optional<ProcedureCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = compact(key);
        return Arrays.stream(values())
                .filter(c -> compact(c.key).equals(normalized))
                .findFirst();
    }

    private static String compact(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
