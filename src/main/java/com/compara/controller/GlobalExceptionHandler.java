package com.compara.controller;

import com.compara.exception.ComparaException;
import com.compara.exception.InputValidationException;
import com.compara.exception.InsufficientCreditsException;
import com.compara.exception.LedgerException;
import com.compara.exception.ModelAccessDeniedException;
import com.compara.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps exceptions raised before streaming starts to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCredits(InsufficientCreditsException e) {
        log.info("Insufficient credits: {}", e.getMessage());
        return respond(HttpStatus.PAYMENT_REQUIRED, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InputValidationException e) {
        log.warn("Invalid comparison request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(ModelAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleModelAccessDenied(ModelAccessDeniedException e) {
        log.warn("Model access denied: {}", e.getRestrictedModels());
        return respond(HttpStatus.FORBIDDEN, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        log.error("Credit ledger failure", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Credit service temporarily unavailable", e.getErrorCode());
    }

    @ExceptionHandler(ComparaException.class)
    public ResponseEntity<ErrorResponse> handleCompara(ComparaException e) {
        log.error("Request failed [{}]", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException e) {
        log.warn("Unreadable request: {}", e.getReason());
        return respond(HttpStatus.BAD_REQUEST, e.getReason(), "INVALID_INPUT");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), message, code));
    }
}
