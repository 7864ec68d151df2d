package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.api.dto.FraudAnalyticsResponse;
import com.hieshield.frauddetector.application.FraudAnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/fraud/analytics")
public class FraudAnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(FraudAnalyticsController.class);

    private final FraudAnalyticsService service;

    public FraudAnalyticsController(FraudAnalyticsService service) {
        this.service = service;
    }

    @GetMapping("/charts")
    public ResponseEntity<FraudAnalyticsResponse> charts(
            @RequestParam(value = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        var report = service.charts(startDate, endDate);
        log.info("Returning fraud analytics - trend days: {}, fraud types: {}",
                report.analytics().fraudTrend().size(), report.analytics().fraudTypes().size());
        return ResponseEntity.ok(FraudAnalyticsResponse.from(report));
    }
}
