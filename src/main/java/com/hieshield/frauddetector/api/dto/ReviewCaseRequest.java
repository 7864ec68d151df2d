package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class ReviewCaseRequest {
  /** approve, flag or investigate */
  @NotBlank public String action;
  @Size(max = 4000) @JsonProperty("review_notes") public String reviewNotes;
}
