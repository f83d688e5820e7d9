package com.example.appendagetransfer.model;

/**
 * Constants shared with callers that script against the archive.
 */
public final class ArchiveConstants {
    public static final AppendageType APPENDAGE_TYPE_FILE = AppendageType.FILE;
    public static final AppendageType APPENDAGE_TYPE_FOLDER = AppendageType.FOLDER;
    public static final AppendageType APPENDAGE_TYPE_IMAGE_SEQUENCE = AppendageType.IMAGE_SEQUENCE;

    /**
     * Parent id of a top-level appendage, attached directly to its job.
     */
    public static final long NO_PARENT = -1L;

    /**
     * Accepted by some calls in place of an id to mean "use the server default".
     */
    public static final int EMPTY_VALUE = -1;

    private ArchiveConstants() {
    }
}
