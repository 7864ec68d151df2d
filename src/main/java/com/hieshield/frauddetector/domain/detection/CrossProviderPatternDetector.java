package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.Violation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags one patient identifier spread over too many hospitals, insurers or
 * name spellings. The three checks are independent of each other.
 */
public class CrossProviderPatternDetector implements ViolationDetector {

    static final int MAX_HOSPITALS = 2;
    static final int MAX_PROVIDERS = 1;
    static final int MAX_NAME_VARIANTS = 1;

    @Override
    public List<Violation> detect(List<ClassifiedClaim> claims) {
        Set<String> hospitals = new LinkedHashSet<>();
        Set<String> providers = new LinkedHashSet<>();
        Set<String> names = new LinkedHashSet<>();

        for (ClassifiedClaim classified : claims) {
            ProcedureClaim claim = classified.getClaim();
            if (hasText(claim.getHospital())) {
                hospitals.add(claim.getHospital());
            }
            if (hasText(claim.getInsuranceProvider())) {
                providers.add(claim.getInsuranceProvider());
            }
            if (hasText(claim.getPatientName())) {
                names.add(claim.getPatientName().trim().toLowerCase(Locale.ROOT));
            }
        }

        List<Violation> violations = new ArrayList<>();
        if (hospitals.size() > MAX_HOSPITALS) {
            violations.add(Violation.crossProvider(new ArrayList<>(hospitals)));
        }
        if (providers.size() > MAX_PROVIDERS) {
            violations.add(Violation.insuranceFraud(new ArrayList<>(providers)));
        }
        if (names.size() > MAX_NAME_VARIANTS) {
            violations.add(Violation.identityReuse(new ArrayList<>(names)));
        }
        return violations;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
