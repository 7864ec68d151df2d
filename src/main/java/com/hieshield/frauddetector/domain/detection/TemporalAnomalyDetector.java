package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.exception.FraudComputationException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flags procedures performed implausibly close together. Claims are ordered by
 * date and only neighbouring claims in that order are compared, so a short gap
 * hidden behind an intervening claim is not reported.
 */
public class TemporalAnomalyDetector implements ViolationDetector {

    public static final int MIN_DAYS_BETWEEN_PROCEDURES = 7;

    @Override
    public List<Violation> detect(List<ClassifiedClaim> claims) {
        List<LocalDate> dates = sortedDates(claims);

        List<Violation> violations = new ArrayList<>();
        for (int i = 1; i < dates.size(); i++) {
            long gap = ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i));
            if (gap < MIN_DAYS_BETWEEN_PROCEDURES) {
                violations.add(Violation.temporalAnomaly(gap, MIN_DAYS_BETWEEN_PROCEDURES));
            }
        }
        return violations;
    }

    /** Claim dates ascending; List.sort is stable so equal dates keep input order. */
    static List<LocalDate> sortedDates(List<ClassifiedClaim> claims) {
        List<LocalDate> dates = new ArrayList<>(claims.size());
        for (int i = 0; i < claims.size(); i++) {
            ProcedureClaim claim = claims.get(i).getClaim();
            if (claim.getDate() == null) {
                throw new FraudComputationException(
                        "Claim at position " + i + " (" + claim.getProcedureName() + ") has no date");
            }
            dates.add(claim.getDate());
        }
        dates.sort(Comparator.naturalOrder());
        return dates;
    }
}
