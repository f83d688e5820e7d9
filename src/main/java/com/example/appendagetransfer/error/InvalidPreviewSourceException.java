package com.example.appendagetransfer.error;

import java.nio.file.Path;

public class InvalidPreviewSourceException extends ArchiveException {
    public InvalidPreviewSourceException(Path path, String reason) {
        super("Invalid preview source " + path + ": " + reason);
    }
}
