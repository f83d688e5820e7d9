package com.example.appendagetransfer.error;

/**
 * Failure reported by, or while talking to, the remote archive.
 */
public abstract class RemoteException extends ArchiveException {
    protected RemoteException(String message) {
        super(message);
    }

    protected RemoteException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when repeating the same request may succeed.
     */
    public abstract boolean isTransient();

    /**
     * True when the failure invalidates the whole job operation, not just one unit.
     */
    public boolean isJobFatal() {
        return false;
    }
}
