package com.questrail.span.pa2.observability;

import java.time.Instant;

/**
 * Record describing a line that could not be decoded.
 */
public record DecodeErrorEvent(
    Instant timestamp,
    String line,
    String message,
    Throwable cause
) {
}
