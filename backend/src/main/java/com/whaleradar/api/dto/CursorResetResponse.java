package com.whaleradar.api.dto;

import java.time.Instant;

/**
 * Result of an operator cursor reset: the next cycle fetches the address from cursor onwards.
 */
public record CursorResetResponse(String address, long cursorMs, Instant cursor) {
}
