package com.example.appendagetransfer.error;

/**
 * Base type for every failure raised while moving appendages to or from the archive.
 */
public class ArchiveException extends Exception {
    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
