package com.scholary.talkingpet.api;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.Fault;
import com.scholary.talkingpet.error.GenerationException;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts workflow failures to HTTP responses.
 *
 * <p>Caller faults are 400. Provider faults are 502 when the provider said no, 503 when it could
 * not be reached and 504 when a job never finished. Internal faults are 500, or 503 when storage
 * is unreachable.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(GenerationException.class)
  public ResponseEntity<ErrorResponse> handleGeneration(GenerationException ex) {
    HttpStatus status = statusFor(ex);
    if (status.is5xxServerError()) {
      LOGGER.error("Generation failed: code={}, message={}", ex.code(), ex.getMessage());
    } else {
      LOGGER.warn("Generation rejected: code={}, message={}", ex.code(), ex.getMessage());
    }
    return ResponseEntity.status(status)
        .body(new ErrorResponse(ex.code(), ex.fault().name(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    LOGGER.warn("Invalid request: {}", message);
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("validation_rejected", Fault.CALLER.name(), message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "validation_rejected", Fault.CALLER.name(), "Request body is not valid JSON"));
  }

  @ExceptionHandler(CompletionException.class)
  public ResponseEntity<ErrorResponse> handleCompletion(CompletionException ex) {
    Throwable cause = Failures.unwrap(ex);
    if (cause instanceof GenerationException) {
      return handleGeneration((GenerationException) cause);
    }
    return unexpected(cause);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    return unexpected(ex);
  }

  private static ResponseEntity<ErrorResponse> unexpected(Throwable ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ErrorResponse(
                "internal_error", Fault.INTERNAL.name(), "An unexpected error occurred"));
  }

  static HttpStatus statusFor(GenerationException ex) {
    switch (ex.code()) {
      case "validation_rejected":
      case "text_too_long":
        return HttpStatus.BAD_REQUEST;
      case "provider_rejected":
      case "job_failed":
        return HttpStatus.BAD_GATEWAY;
      case "provider_unavailable":
      case "storage_unavailable":
        return HttpStatus.SERVICE_UNAVAILABLE;
      case "job_timed_out":
        return HttpStatus.GATEWAY_TIMEOUT;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
