package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public class AnalyzeProceduresRequest {
  @NotBlank @JsonProperty("patient_id") public String patientId;
  @NotEmpty @Valid public List<ProcedureClaimRequest> procedures;
}
