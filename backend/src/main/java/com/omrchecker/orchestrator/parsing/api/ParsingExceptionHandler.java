package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.parsing.service.JobAccessDeniedException;
import com.omrchecker.orchestrator.parsing.service.JobNotFoundException;
import com.omrchecker.orchestrator.parsing.service.JobValidationException;
import com.omrchecker.orchestrator.parsing.service.OperatorAuthenticationException;
import com.omrchecker.orchestrator.parsing.service.SheetParsingException;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ParsingExceptionHandler {

  @ExceptionHandler(OperatorAuthenticationException.class)
  public ResponseEntity<Map<String, String>> handleUnauthenticated(OperatorAuthenticationException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Basic")
        .body(Map.of("error", "unauthorized", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobAccessDeniedException.class)
  public ResponseEntity<Map<String, String>> handleAccessDenied(JobAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(Map.of("error", "access_denied", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler({JobValidationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> handleInvalid(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", "Request body is missing or malformed"));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
  }

  @ExceptionHandler(SheetParsingException.class)
  public ResponseEntity<Map<String, String>> handleParsingFailure(SheetParsingException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "processing_failed", "message", ex.getMessage()));
  }
}
