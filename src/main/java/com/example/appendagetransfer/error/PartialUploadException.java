package com.example.appendagetransfer.error;

import com.example.appendagetransfer.model.JobResult;

/**
 * Raised on request when a job operation finished with failed or aborted units.
 */
public class PartialUploadException extends ArchiveException {
    private final transient JobResult result;

    public PartialUploadException(JobResult result) {
        super(result.operation() + " on " + result.job() + ": " + result.failures().size() + " of "
                + result.units().size() + " units failed");
        this.result = result;
    }

    public JobResult getResult() {
        return result;
    }
}
