package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.application.FraudAnalyticsService;
import com.hieshield.frauddetector.application.FraudAnalyticsService.AnalyticsReport;
import com.hieshield.frauddetector.domain.FraudAnalytics;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.exception.ClaimValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FraudAnalyticsControllerTest {

    @Mock
    private FraudAnalyticsService service;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mvc = MockMvcBuilders.standaloneSetup(new FraudAnalyticsController(service))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldReturnChartData() throws Exception {
        FraudAnalytics analytics = new FraudAnalytics(
                List.of(new FraudAnalytics.DailyTrend(LocalDate.of(2025, 8, 10), 2, 0.5, new BigDecimal("3000.00"))),
                List.of(new FraudAnalytics.TypeCount("anatomical_impossibility", 3, new BigDecimal("15000.00"))),
                List.of(new FraudAnalytics.RiskLevelCount(RiskLevel.CRITICAL, 1, 0.8)),
                List.of(new FraudAnalytics.HospitalPattern(3, 2, 0.65, new BigDecimal("12000.00"))));
        when(service.charts(LocalDate.of(2025, 8, 1), null))
                .thenReturn(new AnalyticsReport(analytics, OffsetDateTime.parse("2025-09-01T14:30:00Z")));

        mvc.perform(get("/fraud/analytics/charts").param("startDate", "2025-08-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fraud_trend[0].date").value("2025-08-10"))
                .andExpect(jsonPath("$.fraud_trend[0].fraud_count").value(2))
                .andExpect(jsonPath("$.fraud_trend[0].avg_confidence").value(0.5))
                .andExpect(jsonPath("$.fraud_types[0].type").value("anatomical_impossibility"))
                .andExpect(jsonPath("$.fraud_types[0].count").value(3))
                .andExpect(jsonPath("$.risk_levels[0].level").value("CRITICAL"))
                .andExpect(jsonPath("$.hospital_patterns[0].hospital_count").value(3))
                .andExpect(jsonPath("$.hospital_patterns[0].case_count").value(2))
                .andExpect(jsonPath("$.generated_at").value("2025-09-01T14:30Z"));
    }

    @Test
    void shouldRejectMalformedDate() throws Exception {
        mvc.perform(get("/fraud/analytics/charts").param("endDate", "31/08/2025"))
                .andExpect(status().isBadRequest());

        verify(service, never()).charts(any(), any());
    }

    @Test
    void shouldRejectInvertedRange() throws Exception {
        when(service.charts(any(), any()))
                .thenThrow(new ClaimValidationException("startDate", "startDate must not be after endDate"));

        mvc.perform(get("/fraud/analytics/charts").param("startDate", "2025-09-01").param("endDate", "2025-08-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("startDate"));
    }
}
