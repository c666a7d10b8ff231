package com.emcit.api.common;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Input problems on the admin, ticket and auth routes. Vault refusals have their own handler.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final Clock clock;

  public ApiExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return reply(HttpStatus.BAD_REQUEST, "bad_request", messageOr(ex, "invalid_request"), null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new TreeMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.putIfAbsent(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return reply(HttpStatus.BAD_REQUEST, "validation_error", "invalid_request", fields);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return reply(HttpStatus.BAD_REQUEST, "validation_error", messageOr(ex, "invalid_request"), null);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return reply(HttpStatus.BAD_REQUEST, "malformed_body", "request body is not valid JSON", null);
  }

  // Unique keys (email, ticket uid, asset id) lost a race past the controller's own check.
  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<Map<String, Object>> conflict(DataIntegrityViolationException ex) {
    log.warn("Rejected write on constraint: {}", ex.getMostSpecificCause().getMessage());
    return reply(HttpStatus.CONFLICT, "conflict", "record already exists", null);
  }

  private ResponseEntity<Map<String, Object>> reply(
      HttpStatus status, String reason, String message, Map<String, String> fields) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", reason);
    body.put("message", message);
    if (fields != null) {
      body.put("fields", fields);
    }
    body.put("ts", clock.instant().toString());
    return ResponseEntity.status(status).body(body);
  }

  private static String messageOr(Exception ex, String fallback) {
    return ex.getMessage() == null || ex.getMessage().isBlank() ? fallback : ex.getMessage();
  }
}
