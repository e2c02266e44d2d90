package com.flamingo.ai.deckindex.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ProcessingRecordNotFoundException.class)
  public ResponseEntity<ApiError> handleRecordNotFound(
      ProcessingRecordNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("record_not_found");
    String errorId = generateErrorId();
    log.warn("Processing record not found [{}]: {}", errorId, ex.getRemoteId());
    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.RECORD_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(IngestionRunInProgressException.class)
  public ResponseEntity<ApiError> handleRunInProgress(
      IngestionRunInProgressException ex, HttpServletRequest request) {
    incrementErrorCounter("run_in_progress");
    String errorId = generateErrorId();
    log.warn("Run rejected [{}]: {}", errorId, ex.getMessage());
    return build(HttpStatus.CONFLICT, errorId, ApiError.RUN_IN_PROGRESS, ex.getMessage(), request);
  }

  @ExceptionHandler(SystemicFailureException.class)
  public ResponseEntity<ApiError> handleSystemicFailure(
      SystemicFailureException ex, HttpServletRequest request) {
    incrementErrorCounter("systemic_failure");
    String errorId = generateErrorId();
    log.error("Run aborted [{}] in stage {}: {}", errorId, ex.getStage(), ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SYSTEMIC_FAILURE,
        "Run aborted: " + ex.getMessage(),
        request);
  }

  @ExceptionHandler(TransientStageException.class)
  public ResponseEntity<ApiError> handleTransient(
      TransientStageException ex, HttpServletRequest request) {
    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        "Search is temporarily unavailable",
        request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    HandlerMethodValidationException.class
  })
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private static ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
