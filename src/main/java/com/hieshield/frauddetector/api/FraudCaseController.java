package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.api.dto.FraudCaseDetailsResponse;
import com.hieshield.frauddetector.api.dto.FraudCaseSummaryResponse;
import com.hieshield.frauddetector.api.dto.ReviewCaseRequest;
import com.hieshield.frauddetector.application.FraudCaseService;
import com.hieshield.frauddetector.domain.FraudCaseRecord;
import com.hieshield.frauddetector.domain.ReviewAction;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.exception.ClaimValidationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/fraud/cases")
public class FraudCaseController {

    private static final Logger log = LoggerFactory.getLogger(FraudCaseController.class);

    static final int MAX_PAGE_SIZE = 100;

    private final FraudCaseService service;

    public FraudCaseController(FraudCaseService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(value = "page", defaultValue = "1") int page,
                                                    @RequestParam(value = "size", defaultValue = "20") int size,
                                                    @RequestParam(value = "riskLevel", required = false) String riskLevel,
                                                    @RequestParam(value = "reviewed", required = false) Boolean reviewed) {
        if (page < 1) {
            throw new ClaimValidationException("page", "page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ClaimValidationException("size", "size must be between 1 and " + MAX_PAGE_SIZE);
        }

        var result = service.list(parseRiskLevel(riskLevel), reviewed, page - 1, size);
        log.info("Returning {} of {} fraud cases", result.items().size(), result.total());

        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("page", page);
        pagination.put("size", size);
        pagination.put("total", result.total());
        pagination.put("pages", result.pages());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cases", result.items().stream().map(FraudCaseSummaryResponse::from).toList());
        body.put("pagination", pagination);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}/details")
    public ResponseEntity<FraudCaseDetailsResponse> details(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(FraudCaseDetailsResponse.from(service.details(id)));
    }

    @PutMapping("/{id}/review")
    public ResponseEntity<Map<String, Object>> review(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody ReviewCaseRequest request) {
        ReviewAction action = ReviewAction.fromCode(request.action)
                .orElseThrow(() -> new ClaimValidationException("action",
                        "Invalid action '" + request.action + "', expected approve, flag or investigate"));

        FraudCaseRecord updated = service.review(id, action, request.reviewNotes);
        log.info("Case {} reviewed by {} - status: {}", id, updated.getReviewer(), updated.getStatus());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", updated.getId().toString());
        body.put("status", updated.getStatus().getCode());
        body.put("reviewed", updated.isReviewed());
        body.put("reviewer", updated.getReviewer());
        body.put("message", "Fraud case marked as " + updated.getStatus().getCode());
        return ResponseEntity.ok(body);
    }

    private static RiskLevel parseRiskLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return RiskLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ClaimValidationException("riskLevel", "Unknown risk level: " + raw, e);
        }
    }
}
