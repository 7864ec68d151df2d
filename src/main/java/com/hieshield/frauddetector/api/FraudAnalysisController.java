package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.api.dto.AnalyzeProceduresRequest;
import com.hieshield.frauddetector.api.dto.FraudAnalysisResponse;
import com.hieshield.frauddetector.application.AnalyzeProceduresCommand;
import com.hieshield.frauddetector.application.FraudAnalysisService;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.exception.ClaimValidationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/fraud")
public class FraudAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(FraudAnalysisController.class);

    private final FraudAnalysisService service;
    private final ClaimRequestMapper mapper;

    public FraudAnalysisController(FraudAnalysisService service, ClaimRequestMapper mapper) {
        this.service = service;
        this.mapper = mapper;
    }

    @PostMapping("/analyze-procedures")
    public ResponseEntity<FraudAnalysisResponse> analyze(@Valid @RequestBody AnalyzeProceduresRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String user = auth != null ? auth.getName() : null;

        log.info("Analyze request - User: {}, Roles: {}, PatientId: {}, Procedures: {}",
                user,
                auth != null ? auth.getAuthorities() : "null",
                request.patientId,
                request.procedures.size());

        List<ProcedureClaim> claims;
        try {
            claims = mapper.toClaims(request);
        } catch (ClaimValidationException e) {
            log.warn("Rejected analyze request for patient {} - {}: {}", request.patientId, e.getField(), e.getMessage());
            service.recordRejected(user, request.patientId);
            throw e;
        }
        var outcome = service.analyze(new AnalyzeProceduresCommand(request.patientId.trim(), claims, user));

        log.info("Analysis for patient {} finished - riskLevel: {}, caseId: {}",
                request.patientId, outcome.result().getRiskLevel(), outcome.caseId());
        return ResponseEntity.ok(FraudAnalysisResponse.from(outcome.result(), outcome.caseId()));
    }
}
