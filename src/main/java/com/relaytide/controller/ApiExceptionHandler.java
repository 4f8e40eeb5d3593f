package com.relaytide.controller;

import com.relaytide.client.UpstreamAuthorizationException;
import com.relaytide.client.UpstreamException;
import com.relaytide.dto.ErrorResponse;
import com.relaytide.model.IngestionErrorCode;
import com.relaytide.retry.DeadlineExceededException;
import com.relaytide.service.AccountAccessDeniedException;
import com.relaytide.service.MalformedNotificationException;
import com.relaytide.service.WebhookVerificationException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 *   malformed payload / bad parameter → 400
 *   webhook secret mismatch           → 401
 *   caller not authorized for account → 403
 *   unknown record / watch            → 404
 *   provider call failed (watch ops)  → 502, with AUTHORIZATION_FAILED or UPSTREAM_UNAVAILABLE
 *   provider call out of time         → 504
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MalformedNotificationException.class)
    public ResponseEntity<ErrorResponse> handleMalformed(MalformedNotificationException e) {
        return respond(HttpStatus.BAD_REQUEST, null, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, null, message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, null, e.getMessage());
    }

    @ExceptionHandler(WebhookVerificationException.class)
    public ResponseEntity<ErrorResponse> handleVerification(WebhookVerificationException e) {
        return respond(HttpStatus.UNAUTHORIZED, null, e.getMessage());
    }

    @ExceptionHandler(AccountAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccountAccessDeniedException e) {
        return respond(HttpStatus.FORBIDDEN, null, e.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, null, e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamException e) {
        IngestionErrorCode code = e instanceof UpstreamAuthorizationException
                ? IngestionErrorCode.AUTHORIZATION_FAILED
                : IngestionErrorCode.UPSTREAM_UNAVAILABLE;
        log.warn("Provider call {} failed: {}", e.getOperation(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, code.name(), e.getMessage());
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ErrorResponse> handleDeadline(DeadlineExceededException e) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, IngestionErrorCode.TIMEOUT.name(), e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
