package com.example.appendagetransfer.error;

import com.example.appendagetransfer.model.JobResult;

/**
 * A job-level precondition failed (authentication rejected, job missing) and the
 * remaining units were abandoned. Carries the outcome of every unit submitted so far.
 */
public class JobAbortedException extends ArchiveException {
    private final transient JobResult partialResult;

    public JobAbortedException(RemoteException cause, JobResult partialResult) {
        super(cause.getMessage(), cause);
        this.partialResult = partialResult;
    }

    public JobResult getPartialResult() {
        return partialResult;
    }

    @Override
    public synchronized RemoteException getCause() {
        return (RemoteException) super.getCause();
    }
}
