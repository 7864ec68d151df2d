package com.hieshield.frauddetector.infrastructure.notify;

import com.hieshield.frauddetector.domain.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

@Component
public class LoggingNotifier implements NotifierPort {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void sendCaseFlagged(String patientId, UUID caseId, Map<String, Object> payload) {
        log.warn("Patient {} fraud case {} flagged for review: {}", patientId, caseId, payload);
    }
}
