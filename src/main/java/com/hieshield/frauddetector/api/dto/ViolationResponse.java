package com.hieshield.frauddetector.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationEvidence;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationResponse(
        String type,
        String severity,
        String description,
        String rule,
        @JsonProperty("procedure_type") String procedureType,
        Integer count,
        Integer limit,
        List<String> hospitals,
        List<String> providers,
        List<String> names,
        @JsonProperty("gap_days") Long gapDays,
        String explanation,
        List<String> evidence) {

    public static ViolationResponse from(ViolationEvidence explained) {
        Violation v = explained.getViolation();
        return new ViolationResponse(
                v.getType().getTag(),
                v.getSeverity().name(),
                v.getDescription(),
                v.getRule(),
                v.getProcedureType() == null ? null : v.getProcedureType().getKey(),
                v.getCount(),
                v.getLimit(),
                v.getHospitals(),
                v.getProviders(),
                v.getNames(),
                v.getGapDays(),
                explained.getExplanation(),
                explained.getEvidence());
    }
}
