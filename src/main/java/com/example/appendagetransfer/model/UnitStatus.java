package com.example.appendagetransfer.model;

public enum UnitStatus {
    /** Bytes sent; server-side processing not observed. */
    TRANSFERRED,
    /** Bytes sent and the appendage reported online. */
    ONLINE,
    /** Bytes sent; online status not reached before the poll timeout. */
    STILL_PROCESSING,
    /** Nothing to do, the destination already held the data. */
    SKIPPED,
    FAILED,
    /** Never started because the run was cancelled or aborted. */
    ABORTED;

    public boolean isSuccess() {
        return this == TRANSFERRED || this == ONLINE || this == STILL_PROCESSING || this == SKIPPED;
    }
}
