package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitStatus;

/**
 * Transfers one unit. Called again with the same {@link UnitProgress} when a transient
 * failure is retried, so implementations skip the steps already completed.
 */
@FunctionalInterface
interface UnitOperation {
    /**
     * @param parentRemoteId remote id produced by the parent unit, or
     *                       {@link com.example.appendagetransfer.model.ArchiveConstants#NO_PARENT} for roots
     */
    Completion perform(TransferUnit unit, long parentRemoteId, UnitProgress progress)
            throws ArchiveException, InterruptedException;

    record Completion(long remoteId, UnitStatus status) {
    }
}
