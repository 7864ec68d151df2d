package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * One row of the classification table: a predicate over the lower-cased
 * procedure name and the category it maps to.
 */
public class ClassificationRule {

    private final String name;
    private final Predicate<String> predicate;
    private final ProcedureCategory category;

    public ClassificationRule(String name, Predicate<String> predicate, ProcedureCategory category) {
        this.name = name;
        this.predicate = predicate;
        this.category = category;
    }

    /** Matches when the name contains the whole phrase. */
    public static ClassificationRule phrase(String phrase, ProcedureCategory category) {
        return new ClassificationRule("contains '" + phrase + "'", n -> n.contains(phrase), category);
    }

    /** Matches when the name contains {@code subject} and at least one of {@code qualifiers}. */
    public static ClassificationRule subjectWithAny(String subject, ProcedureCategory category, String... qualifiers) {
        return new ClassificationRule(
                "contains '" + subject + "' and any of " + Arrays.toString(qualifiers),
                n -> n.contains(subject) && Arrays.stream(qualifiers).anyMatch(n::contains),
                category);
    }

    public boolean matches(String lowerCaseName) {
        return predicate.test(lowerCaseName);
    }

    public String getName() {
        return name;
    }

    public ProcedureCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return name + " -> " + category.getKey();
    }
}
