package com.whaleradar.api.controller;

import com.whaleradar.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400 with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && msg.equals(msg.toUpperCase(Locale.ROOT)) && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        if ("INVALID_ADDRESS".equals(errorCode)) {
            return "Invalid wallet address format";
        }
        return ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
    }
}
