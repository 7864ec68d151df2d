package com.hieshield.frauddetector.domain;

import java.util.List;

public class PatientCaseBundle {

    private final String patientId;
    private final List<ProcedureClaim> claims;

    public PatientCaseBundle(String patientId, List<ProcedureClaim> claims) {
        this.patientId = patientId;
        this.claims = claims == null ? List.of() : List.copyOf(claims);
    }

    public String getPatientId() {
        return patientId;
    }

    public List<ProcedureClaim> getClaims() {
        return claims;
    }
}
