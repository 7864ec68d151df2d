package com.hieshield.frauddetector.infrastructure.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hieshield.frauddetector.domain.CaseStatus;
import com.hieshield.frauddetector.domain.FraudAnalytics;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.FraudType;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.domain.detection.AnatomicalLimits;
import com.hieshield.frauddetector.domain.detection.FraudDetectionEngine;
import com.hieshield.frauddetector.infrastructure.jpa.FraudAlertEntity;
import com.hieshield.frauddetector.infrastructure.jpa.SpringFraudAlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.hieshield.frauddetector.domain.ClaimFixtures.claim;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JpaFraudCaseRepositoryAdapterTest {

    @Mock
    private SpringFraudAlertRepository alerts;

    private JpaFraudCaseRepositoryAdapter adapter;
    private FraudCaseRecord record;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        adapter = new JpaFraudCaseRepositoryAdapter(alerts, new ObjectMapper(), AnatomicalLimits.defaults());

        FraudDetectionEngine engine = new FraudDetectionEngine(AnatomicalLimits.defaults(),
                Clock.fixed(Instant.parse("2025-09-01T00:00:00Z"), ZoneOffset.UTC));
        List<ProcedureClaim> claims = List.of(
                claim("Left leg amputation", "St. Mary", "2025-01-01", "5000", "BlueCross", "John Doe"),
                claim("Right leg amputation", "General", "2025-01-03", "5000.50", "Aetna", "Jon Doe"),
                claim("Leg amputation", "City Clinic", "2025-02-01", "4999.50", null, "John Doe"));
        record = FraudCaseRecord.open(UUID.randomUUID(), engine.analyze("P-1", claims), claims);
        when(alerts.findById(record.getId())).thenReturn(Optional.empty());
    }

    @Test
    void shouldStoreCaseAsJsonColumns() {
        adapter.save(record);

        FraudAlertEntity entity = saved();
        assertThat(entity.getId()).isEqualTo(record.getId());
        assertThat(entity.getFraudType()).isEqualTo("anatomical_impossibility");
        assertThat(entity.getRiskLevel()).isEqualTo(record.getRiskLevel().name());
        assertThat(entity.getStatus()).isEqualTo("pending");
        assertThat(entity.getAnomaliesJson()).contains("\"type\":\"anatomical_violation\"");
        assertThat(entity.getProceduresJson()).contains("\"date\":\"2025-01-03\"");
        assertThat(entity.getDetectionRulesJson()).contains("\"leg_amputation\":2");
    }

    @Test
    void shouldReadBackWhatWasStored() {
        adapter.save(record);
        FraudAlertEntity entity = saved();
        when(alerts.findById(record.getId())).thenReturn(Optional.of(entity));

        FraudCaseRecord loaded = adapter.findById(record.getId()).orElseThrow();

        assertThat(loaded.getPatientId()).isEqualTo("P-1");
        assertThat(loaded.getFraudType()).isEqualTo(FraudType.ANATOMICAL_IMPOSSIBILITY);
        assertThat(loaded.getFraudScore()).isEqualTo(record.getFraudScore());
        assertThat(loaded.getViolations()).isEqualTo(record.getViolations());
        assertThat(loaded.getClaims()).isEqualTo(record.getClaims());
        assertThat(loaded.getStatus()).isEqualTo(CaseStatus.PENDING);
    }

    @Test
    void shouldUpdateReviewStateOnExistingRow() {
        adapter.save(record);
        FraudAlertEntity entity = saved();
        when(alerts.findById(record.getId())).thenReturn(Optional.of(entity));

        adapter.save(record.withReview("dr.grey", "checked", CaseStatus.UNDER_INVESTIGATION));

        assertThat(entity.isReviewed()).isTrue();
        assertThat(entity.getReviewer()).isEqualTo("dr.grey");
        assertThat(entity.getReviewNotes()).isEqualTo("checked");
        assertThat(entity.getStatus()).isEqualTo("under_investigation");
    }

    @Test
    void shouldTranslateFiltersForSearch() {
        when(alerts.search(eq("HIGH"), eq(Boolean.FALSE), any(Pageable.class))).thenReturn(List.of());
        when(alerts.countMatching(null, null)).thenReturn(7L);

        assertThat(adapter.list(RiskLevel.HIGH, false, 2, 25)).isEmpty();
        assertThat(adapter.count(null, null)).isEqualTo(7L);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(alerts).search(eq("HIGH"), eq(Boolean.FALSE), page.capture());
        assertThat(page.getValue().getPageNumber()).isEqualTo(2);
        assertThat(page.getValue().getPageSize()).isEqualTo(25);
    }

    private FraudAlertEntity saved() {
        ArgumentCaptor<FraudAlertEntity> captor = ArgumentCaptor.forClass(FraudAlertEntity.class);
        verify(alerts).save(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldMapAggregateRowsToAnalytics() {
        OffsetDateTime since = OffsetDateTime.parse("2025-08-02T00:00:00Z");
        OffsetDateTime from = OffsetDateTime.parse("2025-08-01T00:00:00Z");
        when(alerts.dailyTrend(since, from, null)).thenReturn(List.<Object[]>of(
                new Object[]{LocalDate.of(2025, 8, 10), 2L, 0.5, new BigDecimal("3000.00")},
                new Object[]{java.sql.Date.valueOf("2025-08-11"), 1L, 0.8, null}));
        when(alerts.countByFraudType(from, null)).thenReturn(List.<Object[]>of(
                new Object[]{"anatomical_impossibility", 3L, new BigDecimal("15000.00")}));
        when(alerts.countByRiskLevel(from, null)).thenReturn(List.<Object[]>of(
                new Object[]{"CRITICAL", 1L, 0.8},
                new Object[]{"MEDIUM", 2L, 0.4}));
        when(alerts.countByHospitalCount(from, null)).thenReturn(List.<Object[]>of(
                new Object[]{3, 2L, 0.65, new BigDecimal("12000.00")}));

        FraudAnalytics analytics = adapter.analytics(from, null, since);

        assertThat(analytics.fraudTrend()).containsExactly(
                new FraudAnalytics.DailyTrend(LocalDate.of(2025, 8, 10), 2, 0.5, new BigDecimal("3000.00")),
                new FraudAnalytics.DailyTrend(LocalDate.of(2025, 8, 11), 1, 0.8, BigDecimal.ZERO));
        assertThat(analytics.fraudTypes()).containsExactly(
                new FraudAnalytics.TypeCount("anatomical_impossibility", 3, new BigDecimal("15000.00")));
        assertThat(analytics.riskLevels()).extracting(FraudAnalytics.RiskLevelCount::level)
                .containsExactly(RiskLevel.CRITICAL, RiskLevel.MEDIUM);
        assertThat(analytics.hospitalPatterns()).singleElement().satisfies(h -> {
            assertThat(h.hospitalCount()).isEqualTo(3);
            assertThat(h.caseCount()).isEqualTo(2);
            assertThat(h.totalAmount()).isEqualByComparingTo("12000");
        });
    }
}
