package com.example.appendagetransfer.error;

public class AuthFailureException extends RemoteException {
    public AuthFailureException(String message) {
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
