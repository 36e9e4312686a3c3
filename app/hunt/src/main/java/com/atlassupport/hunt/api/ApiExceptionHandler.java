/*
 * どこで: Hunt API
 * 何を: 例外を標準エラー応答(code + 平易な message)へ変換する
 * なぜ: 失敗時の契約を一定に保ち、内部の詳細を利用者へ漏らさないため
 */
package com.atlassupport.hunt.api;

import com.atlassupport.hunt.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String RETRY_MESSAGE = "Something went wrong on our side, please retry.";

  @ExceptionHandler(InvalidSupportRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidSupportRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("HUNT_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("HUNT_BAD_REQUEST", ex.getHeaderName() + " header is required"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("HUNT_BAD_REQUEST", "request body is not valid JSON"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("HUNT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(TicketNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTicketNotFound(TicketNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("HUNT_TICKET_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ExpertNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleExpertNotFound(ExpertNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("HUNT_EXPERT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(TicketAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(TicketAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("HUNT_TICKET_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(TicketStateConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(TicketStateConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("HUNT_TICKET_CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
    logger.error("store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("HUNT_STORE_UNAVAILABLE", RETRY_MESSAGE));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("HUNT_INTERNAL_ERROR", RETRY_MESSAGE));
  }
}
