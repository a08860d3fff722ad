package com.questrail.spacelang.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure in the lifting pipeline.
 */
public record LiftingErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
