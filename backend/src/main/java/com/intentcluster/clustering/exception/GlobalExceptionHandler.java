package com.intentcluster.clustering.exception;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions from the clustering endpoints to {@link ErrorResponse} bodies. Client errors
 * are logged at WARN without a stack trace; only unexpected failures are logged at ERROR.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Set<String> QUIET_PATHS =
      Set.of("favicon.ico", ".well-known/appspecific/com.chrome.devtools.json");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(InvalidClusteringParameterException.class)
  public ResponseEntity<ErrorResponse> handleInvalidClusteringParameter(
      InvalidClusteringParameterException ex, WebRequest request) {
    log.warn("Rejected clustering parameter {}: {}", ex.getParameter(), ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        ex.getMessage(),
        Map.of(ex.getParameter(), ex.getMessage()),
        request);
  }

  /** Bad uploads, unknown CSV columns and oversized batches. */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Rejected request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    // first message per field, in binding order
    Map<String, String> errors = new LinkedHashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
    }
    log.warn("Request body failed validation: {}", errors);

    ErrorResponse body = baseResponse(HttpStatus.BAD_REQUEST, "Invalid request data", request);
    body.setError("Validation Failed");
    body.setValidationErrors(errors);
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(CsvValidationException.class)
  public ResponseEntity<ErrorResponse> handleCsvValidation(
      CsvValidationException ex, WebRequest request) {
    log.warn("Malformed CSV at line {}: {}", ex.getLineNumber(), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "Malformed CSV file", null, request);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ErrorResponse> handleMissingPart(
      MissingServletRequestPartException ex, WebRequest request) {
    log.warn("Missing request part: {}", ex.getRequestPartName());
    return respond(
        HttpStatus.BAD_REQUEST,
        "Required part '" + ex.getRequestPartName() + "' is missing",
        null,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, WebRequest request) {
    log.warn("Upload too large: {}", ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        "Uploaded file exceeds the maximum allowed size",
        null,
        request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    String path = extractPath(request);
    if (QUIET_PATHS.stream().anyMatch(path::contains)) {
      return respond(HttpStatus.NOT_FOUND, "Resource not found", null, request);
    }

    String message = "The requested resource was not found";
    if (ex instanceof NoHandlerFoundException) {
      NoHandlerFoundException noHandler = (NoHandlerFoundException) ex;
      message = "No endpoint " + noHandler.getHttpMethod() + " " + noHandler.getRequestURL();
    }
    log.warn("Not found: {}", path);
    return respond(HttpStatus.NOT_FOUND, message, null, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    log.warn("Method {} not allowed on {}", ex.getMethod(), extractPath(request));
    return respond(
        HttpStatus.METHOD_NOT_ALLOWED,
        "Request method '" + ex.getMethod() + "' is not supported",
        null,
        request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "Malformed JSON request", null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Clustering request failed unexpectedly", ex);

    ErrorResponse body =
        baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    if (debugEnabled && !"production".equals(environment)) {
      body.setDebugMessage(ex.getMessage());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String message, Map<String, String> validationErrors, WebRequest request) {
    ErrorResponse body = baseResponse(status, message, request);
    body.setValidationErrors(validationErrors);
    return ResponseEntity.status(status).body(body);
  }

  private ErrorResponse baseResponse(HttpStatus status, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .message(message)
        .path(extractPath(request))
        .build();
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }
}
