package com.example.appendagetransfer.model;

import java.time.Instant;

/**
 * Progress record emitted by a running transfer.
 */
public record TransferEvent(
        Kind kind,
        int unitIndex,
        String relativePath,
        int attempt,
        String message,
        Instant timestamp
) {
    public enum Kind {
        STARTED,
        RETRYING,
        TRANSFERRED,
        SKIPPED,
        FAILED,
        ABORTED,
        ONLINE,
        STILL_PROCESSING,
        FINISHED
    }

    public static TransferEvent of(Kind kind, TransferUnit unit, int attempt, String message) {
        return new TransferEvent(kind, unit.index(), unit.relativePath(), attempt, message, Instant.now());
    }

    public static TransferEvent finished(String message) {
        return new TransferEvent(Kind.FINISHED, TransferUnit.NO_PARENT, "", 0, message, Instant.now());
    }
}
