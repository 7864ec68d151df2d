package com.hieshield.frauddetector.exception;

/**
 * Thrown when the fraud analysis itself fails on input that passed validation.
 */
public class FraudComputationException extends RuntimeException {

    public FraudComputationException(String message) {
        super(message);
    }

    public FraudComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
