package com.example.alerting.api;

import com.example.alerting.service.AlertScheduleNotFoundException;
import com.example.alerting.service.CandidateEntityNotFoundException;
import com.example.alerting.service.InvalidAlertRequestException;
import com.example.alerting.service.MessageTemplateNotFoundException;
import com.example.alerting.service.ProviderNotFoundException;
import com.example.alerting.service.TemplateRenderException;
import com.example.alerting.service.TemplateValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidAlertRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidAlertRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ALERT_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ALERT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleUnreadable(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ALERT_BAD_REQUEST", "request could not be parsed"));
  }

  @ExceptionHandler(AlertScheduleNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleScheduleNotFound(
      AlertScheduleNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALERT_SCHEDULE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(MessageTemplateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateNotFound(
      MessageTemplateNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALERT_TEMPLATE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ProviderNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleProviderNotFound(ProviderNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALERT_PROVIDER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(CandidateEntityNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleEntityNotFound(
      CandidateEntityNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALERT_ENTITY_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(TemplateValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateInvalid(TemplateValidationException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ALERT_TEMPLATE_INVALID", ex.getMessage()));
  }

  @ExceptionHandler(TemplateRenderException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateRender(TemplateRenderException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ALERT_TEMPLATE_RENDER_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled alerting api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ALERT_INTERNAL_ERROR", "internal error"));
  }
}
