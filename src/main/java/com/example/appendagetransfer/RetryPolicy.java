package com.example.appendagetransfer;

import com.example.appendagetransfer.error.RemoteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for transient remote failures.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Runs a single remote call, repeating it while it fails transiently and attempts remain.
     */
    public <T> T call(String description, RemoteCall<T> call) throws RemoteException, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (RemoteException ex) {
                if (!ex.isTransient() || !hasAttemptsLeft(attempt)) {
                    throw ex;
                }
                Duration backoff = backoffAfter(attempt);
                LOGGER.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        description, attempt, maxAttempts, backoff.toMillis(), ex.getMessage());
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws RemoteException;
    }
}
