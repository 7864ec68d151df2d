package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.Violation;

import java.util.List;

/**
 * A single family of fraud rules run over one patient's classified claims.
 * Implementations hold no per-call state and never modify the input.
 */
public interface ViolationDetector {

    List<Violation> detect(List<ClassifiedClaim> claims);
}
