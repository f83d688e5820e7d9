package com.example.appendagetransfer.error;

import java.time.Duration;

/**
 * A single transfer attempt exceeded the configured per-unit timeout. The attempt is
 * abandoned and not retried.
 */
public class TransferTimeoutException extends ArchiveException {
    public TransferTimeoutException(String relativePath, Duration timeout) {
        super("Transfer of " + relativePath + " exceeded " + timeout.toMillis() + " ms");
    }
}
