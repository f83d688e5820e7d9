package com.example.appendagetransfer.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One failed attempt at a unit and what the engine did about it.
 *
 * @param retryable whether the error class allowed another attempt
 * @param backoff   wait before the next attempt, zero when none followed
 */
public record AttemptFailure(
        int attempt,
        Instant failedAt,
        String errorType,
        String message,
        boolean retryable,
        Duration backoff
) {
    public AttemptFailure withBackoff(Duration wait) {
        return new AttemptFailure(attempt, failedAt, errorType, message, retryable, wait);
    }
}
