package com.example.appendagetransfer.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Why a unit ended without reaching the archive (or the local disk).
 * <p>
 * {@code errorType} is the simple name of the exception that ended the unit, or one of
 * {@link #PARENT_FAILED} and {@link #ABORTED} when the unit was never attempted.
 */
public record UnitFailure(
        String relativePath,
        String errorType,
        String message,
        boolean jobFatal,
        int attempts,
        int maxAttempts,
        Instant failedAt,
        List<AttemptFailure> history
) {
    public static final String PARENT_FAILED = "ParentFailed";
    public static final String ABORTED = "Aborted";

    public UnitFailure {
        history = List.copyOf(history);
    }

    public static UnitFailure notAttempted(String relativePath, String errorType, String message) {
        return new UnitFailure(relativePath, errorType, message, false, 0, 0, Instant.now(), List.of());
    }

    /**
     * Time spent waiting between attempts.
     */
    public Duration totalBackoff() {
        return history.stream().map(AttemptFailure::backoff).reduce(Duration.ZERO, Duration::plus);
    }
}
