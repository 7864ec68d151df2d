package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.ProcedureClaim;

import java.util.Optional;

public class ClassifiedClaim {

    private final ProcedureClaim claim;
    private final ProcedureCategory category;

    public ClassifiedClaim(ProcedureClaim claim, ProcedureCategory category) {
        this.claim = claim;
        this.category = category;
    }

    public ProcedureClaim getClaim() {
        return claim;
    }

    public Optional<ProcedureCategory> getCategory() {
        return Optional.ofNullable(category);
    }
}
