package com.example.appendagetransfer.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A local path is missing or cannot be read or written.
 */
public class LocalIoException extends ArchiveException {
    private final Path path;

    public LocalIoException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public LocalIoException(Path path, IOException cause) {
        super("Local I/O failed for " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
