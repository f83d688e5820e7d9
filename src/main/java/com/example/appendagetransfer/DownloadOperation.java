package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.NetworkException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitStatus;
import com.example.appendagetransfer.remote.ArchiveApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes one remote unit to its local destination. Folders become directories; image
 * sequences write their frames into the unit's folder.
 * <p>
 * With {@code resume} set, a file that already exists with the expected size is kept
 * and one with a different size is replaced. A file that fails half way is deleted;
 * directories created on the way stay.
 */
final class DownloadOperation implements UnitOperation {
    private static final Logger LOGGER = LoggerFactory.getLogger(DownloadOperation.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final ArchiveApi api;
    private final JobRef job;
    private final FileVersion version;
    private final boolean resume;

    DownloadOperation(ArchiveApi api, JobRef job, FileVersion version, boolean resume) {
        this.api = api;
        this.job = job;
        this.version = version;
        this.resume = resume;
    }

    @Override
    public Completion perform(TransferUnit unit, long parentRemoteId, UnitProgress progress)
            throws ArchiveException {
        if (unit.type() == AppendageType.FOLDER) {
            createDirectories(unit.localPath());
            return new Completion(unit.remoteId(), UnitStatus.TRANSFERRED);
        }
        if (unit.type() == AppendageType.FILE) {
            Path parent = unit.localPath().toAbsolutePath().getParent();
            if (parent != null) {
                createDirectories(parent);
            }
            long expectedSize = version == FileVersion.ORIGINAL ? unit.size() : -1L;
            boolean written = fetch(unit.localPath(), expectedSize,
                    () -> api.openContent(job, unit.remoteId(), version));
            return new Completion(unit.remoteId(), written ? UnitStatus.TRANSFERRED : UnitStatus.SKIPPED);
        }

        createDirectories(unit.localPath());
        boolean anyWritten = false;
        for (String frame : unit.members()) {
            if (progress.memberDone(frame)) {
                continue;
            }
            Path target = resolveInside(unit.localPath(), frame);
            if (resume && Files.exists(target)) {
                LOGGER.debug("Frame {} already present, skipping", target);
            } else {
                anyWritten |= fetch(target, -1L, () -> api.openFrame(job, unit.remoteId(), frame));
            }
            progress.markMemberDone(frame);
        }
        return new Completion(unit.remoteId(), anyWritten ? UnitStatus.TRANSFERRED : UnitStatus.SKIPPED);
    }

    /**
     * Resolves a name received from the archive against a local directory. The name must
     * denote a direct child of {@code directory}; separators, {@code ..} and absolute names
     * are refused so that a download never writes outside its destination.
     */
    static Path resolveInside(Path directory, String name) throws LocalIoException {
        if (name == null || name.isBlank() || name.equals(".") || name.equals("..")
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw new LocalIoException(directory, "Refusing unsafe remote name '" + name + "'");
        }
        Path resolved;
        try {
            resolved = directory.resolve(name).normalize();
        } catch (InvalidPathException ex) {
            throw new LocalIoException(directory, "Refusing unsafe remote name '" + name + "'");
        }
        if (!directory.normalize().equals(resolved.getParent())) {
            throw new LocalIoException(directory, "Refusing unsafe remote name '" + name + "'");
        }
        return resolved;
    }

    /**
     * Streams one file or frame to {@code target}. Returns false when an existing file was kept.
     *
     * @param expectedSize size that marks an existing file as complete, or -1 if unknown
     */
    private boolean fetch(Path target, long expectedSize, ContentSource source) throws ArchiveException {
        if (Files.exists(target)) {
            if (!resume) {
                throw new LocalIoException(target, "Destination already exists");
            }
            if (expectedSize > 0 && sizeOf(target) == expectedSize) {
                LOGGER.debug("{} already downloaded, skipping", target);
                return false;
            }
            LOGGER.info("Replacing incomplete {}", target);
            deleteQuietly(target);
        }

        boolean complete = false;
        try (InputStream in = source.open();
             OutputStream out = open(target)) {
            copy(in, out, target);
            complete = true;
        } catch (IOException ex) {
            // only close() reaches here; read and write failures are already classified
            throw new LocalIoException(target, ex);
        } finally {
            if (!complete) {
                deleteQuietly(target);
            }
        }
        return true;
    }

    @FunctionalInterface
    private interface ContentSource {
        InputStream open() throws RemoteException;
    }

    private void copy(InputStream in, OutputStream out, Path target) throws RemoteException, LocalIoException {
        byte[] buffer = new byte[BUFFER_SIZE];
        while (true) {
            int read;
            try {
                read = in.read(buffer);
            } catch (IOException ex) {
                throw new NetworkException("Download of " + target.getFileName() + " interrupted", ex);
            }
            if (read < 0) {
                return;
            }
            try {
                out.write(buffer, 0, read);
            } catch (IOException ex) {
                throw new LocalIoException(target, ex);
            }
        }
    }

    private OutputStream open(Path target) throws LocalIoException {
        try {
            return Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new LocalIoException(target, ex);
        }
    }

    private void createDirectories(Path directory) throws LocalIoException {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new LocalIoException(directory, ex);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read size for {}", file, ex);
            return -1L;
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete partial download {}", file, ex);
        }
    }
}
