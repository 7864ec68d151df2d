package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public class ProcedureClaimRequest {
  @NotBlank public String procedure;
  @JsonProperty("procedure_code") public String procedureCode;
  @NotBlank public String hospital;
  @JsonProperty("hospital_id") public String hospitalId;
  /** ISO date, yyyy-MM-dd. */
  @NotBlank public String date;
  @NotNull @PositiveOrZero public BigDecimal amount;
  @JsonProperty("insurance_provider") public String insuranceProvider;
  @JsonProperty("patient_name") public String patientName;
}
