package com.example.appendagetransfer.error;

import com.example.appendagetransfer.model.JobRef;

public class JobNotFoundException extends RemoteException {
    public JobNotFoundException(JobRef job) {
        super("Job not found: " + job);
    }

    public JobNotFoundException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    public boolean isJobFatal() {
        return true;
    }
}
