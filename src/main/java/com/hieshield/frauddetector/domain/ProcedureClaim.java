package com.hieshield.frauddetector.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single billed medical procedure as submitted by a hospital.
 * Patient name is kept exactly as claimed; formatting may vary per submission.
 */
public class ProcedureClaim {

    private final String procedureName;
    private final String procedureCode;
    private final String hospital;
    private final String hospitalId;
    private final LocalDate date;
    private final BigDecimal amount;
    private final String insuranceProvider;
    private final String patientName;

    public ProcedureClaim(String procedureName, String procedureCode, String hospital, String hospitalId,
                          LocalDate date, BigDecimal amount, String insuranceProvider, String patientName) {
        this.procedureName = procedureName;
        this.procedureCode = procedureCode;
        this.hospital = hospital;
        this.hospitalId = hospitalId;
        this.date = date;
        this.amount = amount;
        this.insuranceProvider = insuranceProvider;
        this.patientName = patientName;
    }

    public String getProcedureName() {
        return procedureName;
    }

    public String getProcedureCode() {
        return procedureCode;
    }

    public String getHospital() {
        return hospital;
    }

    public String getHospitalId() {
        return hospitalId;
    }

    public LocalDate getDate() {
        return date;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getInsuranceProvider() {
        return insuranceProvider;
    }

    public String getPatientName() {
        return patientName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcedureClaim that = (ProcedureClaim) o;
        return Objects.equals(procedureName, that.procedureName)
                && Objects.equals(procedureCode, that.procedureCode)
                && Objects.equals(hospital, that.hospital)
                && Objects.equals(hospitalId, that.hospitalId)
                && Objects.equals(date, that.date)
                && Objects.equals(amount, that.amount)
                && Objects.equals(insuranceProvider, that.insuranceProvider)
                && Objects.equals(patientName, that.patientName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(procedureName, procedureCode, hospital, hospitalId, date, amount,
                insuranceProvider, patientName);
    }

    @Override
    public String toString() {
        return "ProcedureClaim{" +
                "procedureName='" + procedureName + '\'' +
                ", hospital='" + hospital + '\'' +
                ", date=" + date +
                ", amount=" + amount +
                '}';
    }
}
