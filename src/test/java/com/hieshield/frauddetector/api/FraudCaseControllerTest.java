package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.application.FraudCaseService;
import com.hieshield.frauddetector.application.FraudCaseService.CasePage;
import com.hieshield.frauddetector.application.FraudCaseService.FraudCaseDetails;
import com.hieshield.frauddetector.domain.CaseStatus;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.ReviewAction;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.domain.detection.AnatomicalLimits;
import com.hieshield.frauddetector.domain.detection.FraudDetectionEngine;
import com.hieshield.frauddetector.exception.FraudCaseNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static com.hieshield.frauddetector.domain.ClaimFixtures.claim;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FraudCaseControllerTest {

    @Mock
    private FraudCaseService service;

    private MockMvc mvc;

    private final FraudDetectionEngine engine = new FraudDetectionEngine(AnatomicalLimits.defaults(),
            Clock.fixed(Instant.parse("2025-09-01T00:00:00Z"), ZoneOffset.UTC));

    private final List<ProcedureClaim> claims = List.of(
            claim("Left leg amputation", "St. Mary", "2025-03-01", "5000", "BlueCross", "John Doe"),
            claim("Right leg amputation", "General", "2025-01-01", "5000", "BlueCross", "John Doe"),
            claim("Leg amputation", "City Clinic", "2025-02-01", "5001", "BlueCross", "John Doe"));

    private FraudCaseRecord stored;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mvc = MockMvcBuilders.standaloneSetup(new FraudCaseController(service))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
        stored = FraudCaseRecord.open(UUID.randomUUID(), engine.analyze("P-1", claims), claims);
    }

    @Test
    void shouldListCasesWithPagination() throws Exception {
        when(service.list(RiskLevel.CRITICAL, false, 0, 20)).thenReturn(new CasePage(List.of(stored), 0, 20, 1));

        mvc.perform(get("/fraud/cases").param("riskLevel", "critical").param("reviewed", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cases[0].id").value(stored.getId().toString()))
                .andExpect(jsonPath("$.cases[0].risk_level").value("HIGH"))
                .andExpect(jsonPath("$.cases[0].violation_count").value(2))
                .andExpect(jsonPath("$.cases[0].status").value("pending"))
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.total").value(1))
                .andExpect(jsonPath("$.pagination.pages").value(1));
    }

    @Test
    void shouldRejectUnknownRiskLevel() throws Exception {
        mvc.perform(get("/fraud/cases").param("riskLevel", "EXTREME"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("riskLevel"));

        verify(service, never()).list(any(), any(), anyInt(), anyInt());
    }

    @Test
    void shouldRejectPageBelowOne() throws Exception {
        mvc.perform(get("/fraud/cases").param("page", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("page"));
    }

    @Test
    void shouldReturnCaseDetails() throws Exception {
        when(service.details(stored.getId())).thenReturn(new FraudCaseDetails(stored,
                engine.getEvidenceExplainer().explainAll(stored.getViolations(), claims),
                List.of(claims.get(1), claims.get(2), claims.get(0)),
                new BigDecimal("5000.33")));

        mvc.perform(get("/fraud/cases/{id}/details", stored.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patient_id").value("P-1"))
                .andExpect(jsonPath("$.financial_impact.total_amount").value(15001))
                .andExpect(jsonPath("$.financial_impact.average_per_procedure").value(5000.33))
                .andExpect(jsonPath("$.timeline[0].date").value("2025-01-01"))
                .andExpect(jsonPath("$.timeline[2].procedure").value("Left leg amputation"))
                .andExpect(jsonPath("$.violations[0].type").value("anatomical_violation"))
                .andExpect(jsonPath("$.violations[0].explanation").exists())
                .andExpect(jsonPath("$.violations[1].type").value("cross_provider_pattern"))
                .andExpect(jsonPath("$.reviewed").value(false));
    }

    @Test
    void shouldReturnNotFoundForUnknownCase() throws Exception {
        UUID missing = UUID.randomUUID();
        when(service.details(missing)).thenThrow(new FraudCaseNotFoundException(missing));

        mvc.perform(get("/fraud/cases/{id}/details", missing))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Fraud case not found: " + missing));
    }

    @Test
    void shouldApplyReviewAction() throws Exception {
        when(service.review(eq(stored.getId()), eq(ReviewAction.FLAG), eq("Duplicate billing confirmed")))
                .thenReturn(stored.withReview("dr.grey", "Duplicate billing confirmed", CaseStatus.CONFIRMED_FRAUD));

        mvc.perform(put("/fraud/cases/{id}/review", stored.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"FLAG\", \"review_notes\": \"Duplicate billing confirmed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("confirmed_fraud"))
                .andExpect(jsonPath("$.reviewed").value(true))
                .andExpect(jsonPath("$.reviewer").value("dr.grey"));
    }

    @Test
    void shouldRejectUnknownReviewAction() throws Exception {
        mvc.perform(put("/fraud/cases/{id}/review", stored.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"delete\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("action"));

        verify(service, never()).review(any(), any(), any());
    }
}
