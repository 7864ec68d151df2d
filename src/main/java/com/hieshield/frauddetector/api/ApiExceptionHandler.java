package com.hieshield.frauddetector.api;

import com.hieshield.frauddetector.exception.ClaimValidationException;
import com.hieshield.frauddetector.exception.FraudCaseNotFoundException;
import com.hieshield.frauddetector.exception.FraudComputationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ClaimValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidClaim(ClaimValidationException ex) {
        log.warn("Validation error on {}: {}", ex.getField(), ex.getMessage());
        Map<String, Object> body = buildBody(HttpStatus.BAD_REQUEST, "Validation failed", ex.getMessage());
        body.put("field", ex.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldError();
        String field = first != null ? first.getField() : null;
        String message = first != null ? field + " " + first.getDefaultMessage() : "Invalid request body";
        log.warn("Request body rejected: {}", message);

        Map<String, Object> body = buildBody(HttpStatus.BAD_REQUEST, "Validation failed", message);
        body.put("field", field);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(buildBody(HttpStatus.BAD_REQUEST, "Malformed request", "Request could not be read"));
    }

    @ExceptionHandler(FraudCaseNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(FraudCaseNotFoundException ex) {
        log.warn("Fraud case {} not found", ex.getCaseId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(buildBody(HttpStatus.NOT_FOUND, "Not found", ex.getMessage()));
    }

    @ExceptionHandler(FraudComputationException.class)
    public ResponseEntity<Map<String, Object>> handleComputation(FraudComputationException ex) {
        log.error("Fraud analysis failed: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError()
                .body(buildBody(HttpStatus.INTERNAL_SERVER_ERROR, "Fraud analysis failed", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // framework errors keep the status Spring assigned
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(buildBody(status, status.getReasonPhrase(), ex.getMessage()));
        }
        log.error("Unhandled exception", ex);
        return ResponseEntity.internalServerError()
                .body(buildBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", "An unexpected error occurred"));
    }

    private static Map<String, Object> buildBody(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
