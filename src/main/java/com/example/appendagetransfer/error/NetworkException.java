package com.example.appendagetransfer.error;

public class NetworkException extends RemoteException {
    private final int status;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public NetworkException(int status, String message) {
        super("HTTP " + status + ": " + message);
        this.status = status;
    }

    /**
     * Response status that triggered the failure, or -1 for connection errors.
     */
    public int getStatus() {
        return status;
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
