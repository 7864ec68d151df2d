package com.hieshield.frauddetector.domain;

import java.util.List;
import java.util.Objects;

/**
 * One rule hit produced by a detector. Type-specific fields are null when they
 * do not apply to the violation type.
 */
public class Violation {

    private final ViolationType type;
    private final Severity severity;
    private final String description;
    private final String rule;

    // anatomical_violation
    private final ProcedureCategory procedureType;
    private final Integer count;
    private final Integer limit;

    // cross_provider_pattern / insurance_fraud / identity_reuse
    private final List<String> hospitals;
    private final List<String> providers;
    private final List<String> names;

    // temporal_anomaly
    private final Long gapDays;

    public Violation(ViolationType type, Severity severity, String description, String rule,
                     ProcedureCategory procedureType, Integer count, Integer limit,
                     List<String> hospitals, List<String> providers, List<String> names, Long gapDays) {
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.description = description;
        this.rule = rule;
        this.procedureType = procedureType;
        this.count = count;
        this.limit = limit;
        this.hospitals = hospitals == null ? null : List.copyOf(hospitals);
        this.providers = providers == null ? null : List.copyOf(providers);
        this.names = names == null ? null : List.copyOf(names);
        this.gapDays = gapDays;
    }

    public static Violation anatomical(ProcedureCategory category, int count, int limit) {
        return new Violation(ViolationType.ANATOMICAL_VIOLATION, Severity.CRITICAL,
                count + " " + category.getLabel() + " procedures exceed human anatomical limit of " + limit,
                "max_" + category.getKey() + " <= " + limit,
                category, count, limit, null, null, null, null);
    }

    public static Violation crossProvider(List<String> hospitals) {
        return new Violation(ViolationType.CROSS_PROVIDER_PATTERN, Severity.HIGH,
                "Claims submitted to " + hospitals.size() + " different hospitals",
                "multiple_hospitals_same_patient",
                null, null, null, hospitals, null, null, null);
    }

    public static Violation insuranceFraud(List<String> providers) {
        return new Violation(ViolationType.INSURANCE_FRAUD, Severity.HIGH,
                "Claims submitted to " + providers.size() + " different insurance providers",
                "multiple_insurance_providers",
                null, null, null, null, providers, null, null);
    }

    public static Violation identityReuse(List<String> names) {
        return new Violation(ViolationType.IDENTITY_REUSE, Severity.HIGH,
                "Same patient ID with " + names.size() + " different name variations",
                "name_variations_same_id",
                null, null, null, null, null, names, null);
    }

    public static Violation temporalAnomaly(long gapDays, int minDays) {
        return new Violation(ViolationType.TEMPORAL_ANOMALY, Severity.MEDIUM,
                "Major procedures only " + gapDays + " days apart",
                "min_days_between_procedures >= " + minDays,
                null, null, null, null, null, null, gapDays);
    }

    public ViolationType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getRule() {
        return rule;
    }

    public ProcedureCategory getProcedureType() {
        return procedureType;
    }

    public Integer getCount() {
        return count;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getHospitals() {
        return hospitals;
    }

    public List<String> getProviders() {
        return providers;
    }

    public List<String> getNames() {
        return names;
    }

    public Long getGapDays() {
        return gapDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return type == that.type
                && severity == that.severity
                && Objects.equals(description, that.description)
                && Objects.equals(rule, that.rule)
                && procedureType == that.procedureType
                && Objects.equals(count, that.count)
                && Objects.equals(limit, that.limit)
                && Objects.equals(hospitals, that.hospitals)
                && Objects.equals(providers, that.providers)
                && Objects.equals(names, that.names)
                && Objects.equals(gapDays, that.gapDays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, description, rule, procedureType, count, limit,
                hospitals, providers, names, gapDays);
    }

    @Override
    public String toString() {
        return type.getTag() + "[" + severity + "] " + description;
    }
}
