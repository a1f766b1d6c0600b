package com.dcaswap.api.controller;

import com.dcaswap.api.dto.ErrorBody;
import com.dcaswap.dca.schedule.ScheduleServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400 and service errors to their status, all with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(ScheduleServiceException.class)
    public ResponseEntity<ErrorBody> handleScheduleService(ScheduleServiceException ex) {
        HttpStatus status = ScheduleServiceException.SCHEDULE_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    /** Registry unreachable while listing tokens. */
    @ExceptionHandler(WebClientException.class)
    public ResponseEntity<ErrorBody> handleUpstream(WebClientException ex) {
        log.warn("Upstream call failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("UPSTREAM_UNAVAILABLE", "Upstream service unavailable"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid Ethereum address";
            case "INVALID_TOKEN" -> "Invalid token address, decimals or symbol";
            case "INVALID_PURCHASE_AMOUNT" -> "Must be at least $1.00 USD with up to 2 decimal places";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
