package com.hieshield.frauddetector.domain.ports;

import java.util.Map;
import java.util.UUID;

public interface NotifierPort {

    void sendCaseFlagged(String patientId, UUID caseId, Map<String, Object> payload);
}
