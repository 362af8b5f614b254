package com.whaleradar.api.dto;

import java.time.Instant;

/**
 * Standard error response body: error (code), message, timestamp (ISO 8601).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
