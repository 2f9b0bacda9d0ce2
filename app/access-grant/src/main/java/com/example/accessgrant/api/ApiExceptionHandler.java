/*
 * どこで: Access grant API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: エラー分類ごとのステータスとコードを 1 箇所で揃えるため
 */
package com.example.accessgrant.api;

import com.example.accessgrant.service.PetOwnershipIntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  // grant の有無や所有者を推測されないよう、拒否理由は常に同じ文言で返す。
  static final String FORBIDDEN_MESSAGE = "forbidden";

  @ExceptionHandler(GrantForbiddenException.class)
  public ResponseEntity<ApiErrorResponse> handleForbidden(GrantForbiddenException ex) {
    logger.info("access grant request forbidden reason={}", ex.getMessage());
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.FORBIDDEN, FORBIDDEN_MESSAGE);
  }

  @ExceptionHandler(GrantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleGrantNotFound(GrantNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.GRANT_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(PetNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handlePetNotFound(PetNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.PET_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(InvalidGrantTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(
      InvalidGrantTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.GRANT_STATE_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(PetOwnershipIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleOwnershipUnavailable(
      PetOwnershipIntegrationException ex) {
    logger.warn("pet ownership lookup failed reason={}", ex.reason(), ex);
    return error(
        HttpStatus.BAD_GATEWAY,
        ApiErrorCode.PET_OWNERSHIP_UNAVAILABLE,
        "pet ownership service is unavailable");
  }

  @ExceptionHandler(OperationCancelledException.class)
  public ResponseEntity<ApiErrorResponse> handleCancelled(OperationCancelledException ex) {
    logger.warn("access grant request cancelled reason={}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.REQUEST_CANCELLED, ex.getMessage());
  }

  @ExceptionHandler(CallerIdentityMissingException.class)
  public ResponseEntity<ApiErrorResponse> handleCallerMissing(CallerIdentityMissingException ex) {
    return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    if (CallerHeaders.HEADER_USER_ID.equalsIgnoreCase(ex.getHeaderName())) {
      return error(
          HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, ex.getHeaderName() + " is required");
    }
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(InvalidGrantInputException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidInput(InvalidGrantInputException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
