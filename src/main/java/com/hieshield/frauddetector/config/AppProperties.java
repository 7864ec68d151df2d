package com.hieshield.frauddetector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Fraud fraud = new Fraud();
    public Fraud getFraud(){ return fraud; }

    public static class Fraud {
        // cases scoring strictly above this are stored for review
        private double persistThreshold = 0.3;
        // category key -> max count; empty means the built-in table
        private Map<String, Integer> anatomicalLimits = new LinkedHashMap<>();

        public double getPersistThreshold(){ return persistThreshold; }
        public void setPersistThreshold(double persistThreshold){ this.persistThreshold = persistThreshold; }

        public Map<String, Integer> getAnatomicalLimits(){ return anatomicalLimits; }
        public void setAnatomicalLimits(Map<String, Integer> anatomicalLimits){ this.anatomicalLimits = anatomicalLimits; }
    }
}
