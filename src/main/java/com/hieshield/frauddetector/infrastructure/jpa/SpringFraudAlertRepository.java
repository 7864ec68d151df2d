package com.hieshield.frauddetector.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface SpringFraudAlertRepository extends JpaRepository<FraudAlertEntity, UUID> {

    @Query("SELECT a FROM FraudAlertEntity a " +
            "WHERE (:riskLevel IS NULL OR a.riskLevel = :riskLevel) " +
            "AND (:reviewed IS NULL OR a.reviewed = :reviewed) " +
            "ORDER BY a.fraudConfidence DESC, a.createdAt DESC")
    List<FraudAlertEntity> search(@Param("riskLevel") String riskLevel,
                                  @Param("reviewed") Boolean reviewed,
                                  Pageable pageable);

    @Query("SELECT COUNT(a) FROM FraudAlertEntity a " +
            "WHERE (:riskLevel IS NULL OR a.riskLevel = :riskLevel) " +
            "AND (:reviewed IS NULL OR a.reviewed = :reviewed)")
    long countMatching(@Param("riskLevel") String riskLevel, @Param("reviewed") Boolean reviewed);

    String CREATED_WITHIN = "(:from IS NULL OR a.createdAt >= :from) AND (:to IS NULL OR a.createdAt < :to)";

    // rows: day, case count, average confidence, amount sum
    @Query("SELECT CAST(a.createdAt AS LocalDate), COUNT(a), AVG(a.fraudConfidence), SUM(a.totalAmount) " +
            "FROM FraudAlertEntity a WHERE a.createdAt >= :since AND " + CREATED_WITHIN + " " +
            "GROUP BY CAST(a.createdAt AS LocalDate) ORDER BY CAST(a.createdAt AS LocalDate)")
    List<Object[]> dailyTrend(@Param("since") OffsetDateTime since,
                              @Param("from") OffsetDateTime from,
                              @Param("to") OffsetDateTime to);

    // rows: fraud type, case count, amount sum
    @Query("SELECT a.fraudType, COUNT(a), SUM(a.totalAmount) FROM FraudAlertEntity a " +
            "WHERE " + CREATED_WITHIN + " GROUP BY a.fraudType ORDER BY COUNT(a) DESC")
    List<Object[]> countByFraudType(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    // rows: risk level, case count, average confidence
    @Query("SELECT a.riskLevel, COUNT(a), AVG(a.fraudConfidence) FROM FraudAlertEntity a " +
            "WHERE " + CREATED_WITHIN + " GROUP BY a.riskLevel ORDER BY AVG(a.fraudConfidence) DESC")
    List<Object[]> countByRiskLevel(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    // rows: hospital count, case count, average confidence, amount sum
    @Query("SELECT a.hospitalCount, COUNT(a), AVG(a.fraudConfidence), SUM(a.totalAmount) " +
            "FROM FraudAlertEntity a WHERE " + CREATED_WITHIN + " " +
            "GROUP BY a.hospitalCount ORDER BY a.hospitalCount")
    List<Object[]> countByHospitalCount(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);
}
