package com.hieshield.frauddetector.config;

import com.hieshield.frauddetector.domain.ProcedureCategory;
import com.hieshield.frauddetector.domain.detection.AnatomicalLimits;
import com.hieshield.frauddetector.domain.detection.FraudDetectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

@Configuration
public class FraudEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(FraudEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AnatomicalLimits anatomicalLimits(AppProperties properties) {
        return toLimits(properties.getFraud().getAnatomicalLimits());
    }

    @Bean
    public FraudDetectionEngine fraudDetectionEngine(AnatomicalLimits limits, Clock clock) {
        log.info("Fraud detection engine initialized with anatomical limits: {}", limits.asMap());
        return new FraudDetectionEngine(limits, clock);
    }

    static AnatomicalLimits toLimits(Map<String, Integer> configured) {
        if (configured == null || configured.isEmpty()) {
            return AnatomicalLimits.defaults();
        }
        Map<ProcedureCategory, Integer> limits = new EnumMap<>(ProcedureCategory.class);
        configured.forEach((key, limit) -> {
            ProcedureCategory category = ProcedureCategory.fromKey(key)
                    .orElseThrow(() -> new IllegalStateException(
                            "Unknown procedure category in app.fraud.anatomical-limits: " + key));
            limits.put(category, limit);
        });
        return new AnatomicalLimits(limits);
    }
}
