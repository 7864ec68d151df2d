package com.hieshield.frauddetector.exception;

/**
 * Thrown when a submitted claim is missing a required field or carries an
 * out-of-range value. Raised before any analysis runs.
 */
public class ClaimValidationException extends RuntimeException {

    private final String field;

    /**
     * @param field   the offending request field, e.g. {@code procedures[2].date}
     * @param message the detail message
     */
    public ClaimValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ClaimValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
