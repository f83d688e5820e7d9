package com.example.appendagetransfer.error;

/**
 * The archive refused a request for a reason that repeating it will not fix.
 */
public class RemoteRejectionException extends RemoteException {
    public enum Reason {
        VALIDATION,
        QUOTA,
        PERMISSION,
        CONFLICT,
        NOT_FOUND
    }

    private final Reason reason;

    public RemoteRejectionException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
