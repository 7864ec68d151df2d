package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.api.dto.AnalyzeProceduresRequest;
import com.hieshield.frauddetector.api.dto.ProcedureClaimRequest;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.exception.ClaimValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns request bodies into domain claims. Bean Validation covers presence;
 * this class rejects values the annotations cannot express, such as dates
 * that do not parse.
 */
@Component
public class ClaimRequestMapper {

    public List<ProcedureClaim> toClaims(AnalyzeProceduresRequest request) {
        if (request.patientId == null || request.patientId.isBlank()) {
            throw new ClaimValidationException("patient_id", "patient_id is required");
        }
        if (request.procedures == null || request.procedures.isEmpty()) {
            throw new ClaimValidationException("procedures", "At least one procedure is required");
        }

        List<ProcedureClaim> claims = new ArrayList<>(request.procedures.size());
        for (int i = 0; i < request.procedures.size(); i++) {
            claims.add(toClaim(request.procedures.get(i), "procedures[" + i + "]"));
        }
        return claims;
    }

    ProcedureClaim toClaim(ProcedureClaimRequest p, String path) {
        if (p == null) {
            throw new ClaimValidationException(path, "Procedure entry must not be null");
        }
        requireText(p.procedure, path + ".procedure");
        requireText(p.hospital, path + ".hospital");
        if (p.amount == null) {
            throw new ClaimValidationException(path + ".amount", "amount is required");
        }
        if (p.amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new ClaimValidationException(path + ".amount", "amount must not be negative: " + p.amount);
        }

        return new ProcedureClaim(
                p.procedure.trim(),
                blankToNull(p.procedureCode),
                p.hospital.trim(),
                blankToNull(p.hospitalId),
                parseDate(p.date, path + ".date"),
                p.amount,
                blankToNull(p.insuranceProvider),
                blankToNull(p.patientName));
    }

    static LocalDate parseDate(String raw, String field) {
        requireText(raw, field);
        String value = raw.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            try {
                // full timestamps are accepted, only the date part is kept
                return OffsetDateTime.parse(value).toLocalDate();
            } catch (DateTimeParseException notTimestamp) {
                throw new ClaimValidationException(field, "Invalid date '" + raw + "', expected yyyy-MM-dd", e);
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ClaimValidationException(field, field + " is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
