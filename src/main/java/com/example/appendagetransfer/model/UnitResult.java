package com.example.appendagetransfer.model;

/**
 * Outcome of one submitted unit: either the remote appendage id (downloads report the
 * source appendage) or the failure that ended it.
 */
public class UnitResult {
    private final String relativePath;
    private final AppendageType type;
    private final UnitStatus status;
    private final long appendageId;
    private final long bytes;
    private final UnitFailure failure;

    private UnitResult(String relativePath,
                       AppendageType type,
                       UnitStatus status,
                       long appendageId,
                       long bytes,
                       UnitFailure failure) {
        this.relativePath = relativePath;
        this.type = type;
        this.status = status;
        this.appendageId = appendageId;
        this.bytes = bytes;
        this.failure = failure;
    }

    public static UnitResult success(TransferUnit unit, UnitStatus status, long appendageId) {
        if (!status.isSuccess()) {
            throw new IllegalArgumentException("Not a success status: " + status);
        }
        return new UnitResult(unit.relativePath(), unit.type(), status, appendageId, unit.size(), null);
    }

    public static UnitResult failure(TransferUnit unit, UnitFailure failure) {
        return new UnitResult(unit.relativePath(), unit.type(), UnitStatus.FAILED, TransferUnit.NO_REMOTE_ID, 0L, failure);
    }

    public static UnitResult aborted(TransferUnit unit, String reason) {
        UnitFailure failure = UnitFailure.notAttempted(unit.relativePath(), UnitFailure.ABORTED, reason);
        return new UnitResult(unit.relativePath(), unit.type(), UnitStatus.ABORTED, TransferUnit.NO_REMOTE_ID, 0L, failure);
    }

    /**
     * Copy of this result with the status observed by a later online poll.
     */
    public UnitResult withStatus(UnitStatus newStatus) {
        return new UnitResult(relativePath, type, newStatus, appendageId, bytes, failure);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public String getRelativePath() {
        return relativePath;
    }

    public AppendageType getType() {
        return type;
    }

    public UnitStatus getStatus() {
        return status;
    }

    public long getAppendageId() {
        return appendageId;
    }

    public long getBytes() {
        return bytes;
    }

    public UnitFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return relativePath + "=" + status + (failure == null ? "" : "(" + failure.message() + ")");
    }
}
