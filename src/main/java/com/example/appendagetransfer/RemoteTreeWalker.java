package com.example.appendagetransfer;

import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.Appendage;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.WalkDiagnostic;
import com.example.appendagetransfer.remote.ArchiveApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks a remote folder appendage depth-first and yields download units, parents first.
 * The folder is written to {@code rootPath}; image-sequence frames are written straight
 * into the folder that contains the sequence. A child whose name would leave its parent
 * directory is reported as a diagnostic and not downloaded.
 * <p>
 * Children are listed only when the walk reaches their folder. A folder that cannot be
 * listed is reported as a diagnostic and its subtree skipped, unless the failure is
 * job-fatal, which ends the walk.
 */
final class RemoteTreeWalker implements UnitSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteTreeWalker.class);
    private static final String SEPARATOR = "/";

    private final ArchiveApi api;
    private final JobRef job;
    private final RetryPolicy retryPolicy;
    private final Appendage root;
    private final Path rootPath;
    private final Deque<Level> stack = new ArrayDeque<>();
    private final List<WalkDiagnostic> diagnostics = new ArrayList<>();
    private TransferUnit lookahead;
    private boolean rootEmitted;
    private boolean stopped;
    private RemoteException abortCause;
    private int nextIndex;

    RemoteTreeWalker(ArchiveApi api,
                     JobRef job,
                     RetryPolicy retryPolicy,
                     Appendage root,
                     Path rootPath) {
        if (root.type() != AppendageType.FOLDER) {
            throw new IllegalArgumentException("Appendage " + root.id() + " is not a folder");
        }
        this.api = api;
        this.job = job;
        this.retryPolicy = retryPolicy;
        this.root = root;
        this.rootPath = rootPath;
    }

    @Override
    public List<WalkDiagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    @Override
    public RemoteException abortCause() {
        return abortCause;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !stopped) {
            lookahead = advance();
        }
        return lookahead != null;
    }

    @Override
    public TransferUnit next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        TransferUnit unit = lookahead;
        lookahead = null;
        return unit;
    }

    private TransferUnit advance() {
        if (!rootEmitted) {
            rootEmitted = true;
            TransferUnit unit = new TransferUnit(nextIndex++, TransferUnit.NO_PARENT, root.fileName(),
                    root.fileName(), AppendageType.FOLDER, rootPath, root.id(), 0L,
                    List.of());
            stack.push(new Level(unit));
            return unit;
        }
        while (!stack.isEmpty()) {
            Level level = stack.peek();
            if (level.children == null) {
                level.children = list(level.folder);
                if (stopped) {
                    return null;
                }
            }
            if (!level.children.hasNext()) {
                stack.pop();
                continue;
            }
            Appendage child = level.children.next();
            String relativePath = level.folder.relativePath() + SEPARATOR + child.fileName();
            Path childPath = localPath(level.folder, child.fileName(), relativePath);
            if (childPath == null) {
                continue;
            }
            TransferUnit unit;
            if (child.type() == AppendageType.IMAGE_SEQUENCE) {
                List<String> frames = frames(child, relativePath);
                if (frames == null) {
                    if (stopped) {
                        return null;
                    }
                    continue;
                }
                if (!framesStayInside(level.folder, frames, relativePath)) {
                    continue;
                }
                unit = new TransferUnit(nextIndex++, level.folder.index(), relativePath, child.fileName(),
                        child.type(), level.folder.localPath(), child.id(), child.size(), frames);
            } else {
                unit = new TransferUnit(nextIndex++, level.folder.index(), relativePath, child.fileName(),
                        child.type(), childPath, child.id(), child.size(), List.of());
            }
            if (child.type() == AppendageType.FOLDER) {
                stack.push(new Level(unit));
            }
            return unit;
        }
        return null;
    }

    private Iterator<Appendage> list(TransferUnit folder) {
        try {
            List<Appendage> children = new ArrayList<>(retryPolicy.call("list " + folder.relativePath(),
                    () -> api.listChildren(job, folder.remoteId())));
            children.sort(Comparator.comparing(Appendage::fileName));
            return children.iterator();
        } catch (RemoteException ex) {
            lost(folder.relativePath(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            stopped = true;
        }
        return List.<Appendage>of().iterator();
    }

    private List<String> frames(Appendage sequence, String relativePath) {
        try {
            return retryPolicy.call("list frames of " + relativePath, () -> api.listFrameNames(job, sequence.id()));
        } catch (RemoteException ex) {
            lost(relativePath, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            stopped = true;
        }
        return null;
    }

    private Path localPath(TransferUnit folder, String name, String relativePath) {
        try {
            return DownloadOperation.resolveInside(folder.localPath(), name);
        } catch (LocalIoException ex) {
            unsafe(relativePath, ex);
            return null;
        }
    }

    private boolean framesStayInside(TransferUnit folder, List<String> frames, String relativePath) {
        for (String frame : frames) {
            try {
                DownloadOperation.resolveInside(folder.localPath(), frame);
            } catch (LocalIoException ex) {
                unsafe(relativePath, ex);
                return false;
            }
        }
        return true;
    }

    private void unsafe(String relativePath, LocalIoException ex) {
        LOGGER.warn("Skipping remote {}: {}", relativePath, ex.getMessage());
        diagnostics.add(new WalkDiagnostic(relativePath, ex.getClass().getSimpleName(), ex.getMessage(), true));
    }

    private void lost(String relativePath, RemoteException ex) {
        if (ex.isJobFatal()) {
            LOGGER.error("Listing {} failed with a job-level error: {}", relativePath, ex.getMessage());
            abortCause = ex;
            stopped = true;
            return;
        }
        LOGGER.warn("Failed to list remote {}, skipping it: {}", relativePath, ex.getMessage());
        diagnostics.add(new WalkDiagnostic(relativePath, ex.getClass().getSimpleName(),
                "Remote appendage could not be listed: " + ex.getMessage(), true));
    }

    private static final class Level {
        private final TransferUnit folder;
        private Iterator<Appendage> children;

        private Level(TransferUnit folder) {
            this.folder = folder;
        }
    }
}
