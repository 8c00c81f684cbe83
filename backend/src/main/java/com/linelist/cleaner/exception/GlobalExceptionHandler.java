package com.linelist.cleaner.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Maps cleaning and request errors onto {@link ErrorResponse} bodies. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String PRODUCTION = "production";

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(WordlistConfigurationException.class)
  public ResponseEntity<ErrorResponse> handleWordlistConfigurationException(
      WordlistConfigurationException ex, WebRequest request) {
    log.error("Rejected cleaning run: {}", ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorBody(HttpStatus.BAD_REQUEST, "Invalid Configuration", ex.getMessage(), request));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.error("Invalid argument: {}", ex.getMessage());
    return badRequest(ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> fieldErrors = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
    }
    log.error("Request validation failed: {}", fieldErrors);

    ErrorResponse body =
        errorBody(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request data", request);
    body.setValidationErrors(fieldErrors);
    return respond(HttpStatus.BAD_REQUEST, body);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ErrorResponse> handleMissingPart(
      MissingServletRequestPartException ex, WebRequest request) {
    log.warn("Missing upload part: {}", ex.getRequestPartName());
    return badRequest(
        String.format("Required file '%s' is missing", ex.getRequestPartName()), request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex, WebRequest request) {
    log.warn("Missing request parameter: {}", ex.getParameterName());
    return badRequest(
        String.format("Required parameter '%s' is missing", ex.getParameterName()), request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return badRequest("Malformed JSON request", request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    String message =
        ex instanceof NoHandlerFoundException
            ? String.format(
                "No endpoint %s %s",
                ((NoHandlerFoundException) ex).getHttpMethod(),
                ((NoHandlerFoundException) ex).getRequestURL())
            : "The requested resource was not found";
    log.warn("Not found: {}", message);
    return simple(HttpStatus.NOT_FOUND, message, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return simple(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error while cleaning", ex);
    HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    ErrorResponse body =
        errorBody(status, status.getReasonPhrase(), "An unexpected error occurred", request);
    if (debugEnabled && !PRODUCTION.equals(environment)) {
      body.setDebugMessage(ex.getMessage());
    }
    return respond(status, body);
  }

  private ResponseEntity<ErrorResponse> badRequest(String message, WebRequest request) {
    return simple(HttpStatus.BAD_REQUEST, message, request);
  }

  private ResponseEntity<ErrorResponse> simple(
      HttpStatus status, String message, WebRequest request) {
    return respond(status, errorBody(status, status.getReasonPhrase(), message, request));
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
    return new ResponseEntity<>(body, status);
  }

  private ErrorResponse errorBody(
      HttpStatus status, String error, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(error)
        .message(message)
        .path(request.getDescription(false).replace("uri=", ""))
        .build();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error body returned by the cleaning endpoints")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
