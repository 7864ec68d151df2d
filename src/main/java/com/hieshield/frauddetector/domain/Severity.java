package com.hieshield.frauddetector.domain;

public enum Severity {
    CRITICAL(0.4),
    HIGH(0.25),
    MEDIUM(0.15),
    LOW(0.05);

    private final double weight;

    Severity(double weight) {
        this.weight = weight;
    }

    /** Contribution of one violation of this severity to the fraud score. */
    public double getWeight() {
        return weight;
    }
}
