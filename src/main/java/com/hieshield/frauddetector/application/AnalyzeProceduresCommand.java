package com.hieshield.frauddetector.application;

import com.hieshield.frauddetector.domain.ProcedureClaim;

import java.util.List;

public class AnalyzeProceduresCommand {
    public final String patientId;
    public final List<ProcedureClaim> procedures;
    public final String requestedBy;

    public AnalyzeProceduresCommand(String patientId, List<ProcedureClaim> procedures, String requestedBy) {
        this.patientId = patientId;
        this.procedures = List.copyOf(procedures);
        this.requestedBy = requestedBy;
    }
}
