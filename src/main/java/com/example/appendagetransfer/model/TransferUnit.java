package com.example.appendagetransfer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * One unit of a transfer plan. Units are numbered in emission order and refer to their
 * parent by index ({@code -1} for the root), so a plan never owns nested units.
 * <p>
 * For uploads {@code localPath} is the source and {@code remoteId} is unset; for downloads
 * {@code remoteId} is the source appendage and {@code localPath} the destination.
 * Image sequences list their frame files (upload) or frame names (download) in
 * {@code members}; {@code localPath} is then the folder holding the frames.
 */
public record TransferUnit(
        int index,
        int parentIndex,
        String relativePath,
        String name,
        AppendageType type,
        Path localPath,
        long remoteId,
        long size,
        List<String> members
) {
    public static final int NO_PARENT = -1;
    public static final long NO_REMOTE_ID = -1L;

    public TransferUnit {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }
}
