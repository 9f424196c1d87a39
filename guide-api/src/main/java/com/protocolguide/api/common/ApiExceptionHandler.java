package com.protocolguide.api.common;

import com.protocolguide.api.tracing.RequestContext;
import com.protocolguide.application.ports.BillingGatewayException;
import com.protocolguide.application.resilience.CircuitOpenException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(body("bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    Map<String, Object> body = body("validation_error", "invalid_request");
    body.put("fields", fields);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(body("validation_error", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
  }

  /**
   * Dependency is known to be down: tell the client when to come back instead of failing slowly.
   */
  @ExceptionHandler(CircuitOpenException.class)
  public ResponseEntity<Map<String, Object>> circuitOpen(CircuitOpenException ex) {
    log.warn("Rejected call, circuit {} open (retry in {} ms)", ex.circuit(), ex.retryAfterMs());
    Map<String, Object> body = body("circuit_open", ex.getMessage());
    body.put("circuit", ex.circuit());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, Long.toString(Math.max(1, ex.retryAfterSeconds())))
        .body(body);
  }

  @ExceptionHandler(BillingGatewayException.class)
  public ResponseEntity<Map<String, Object>> billingProvider(BillingGatewayException ex) {
    log.error("Billing provider call failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(body("billing_provider_error", "Billing provider request failed"));
  }

  private static Map<String, Object> body(String reason, String message) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "error");
    m.put("reason", reason);
    m.put("message", message);
    m.put("requestId", RequestContext.requestId());
    m.put("ts", Instant.now().toString());
    return m;
  }
}
