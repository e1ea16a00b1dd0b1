package com.alpharadar.api.controller;

import com.alpharadar.api.dto.ErrorBody;
import com.alpharadar.ingestion.store.MentionStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400 and mention store outages to 503, both with ErrorBody.
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

    @ExceptionHandler(MentionStoreException.class)
    public ResponseEntity<ErrorBody> handleStoreFailure(MentionStoreException ex) {
        log.error("Mention store failure while serving request", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", "Mention store is unavailable, retry later"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Contract address is required";
            case "INVALID_CHAIN" -> "Chain must be one of: solana, evm";
            case "INVALID_SOURCE" -> "sourceId is required";
            case "INVALID_OCCURRENCE" -> "occurrenceId is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
