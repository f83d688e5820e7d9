package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.error.InvalidPreviewSourceException;
import com.example.appendagetransfer.error.JobAbortedException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.model.Appendage;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.JobResult;
import com.example.appendagetransfer.model.PreviewDirective;
import com.example.appendagetransfer.model.TransferEvent;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitResult;
import com.example.appendagetransfer.model.UnitStatus;
import com.example.appendagetransfer.remote.ArchiveApi;
import com.example.appendagetransfer.remote.ArchiveSession;
import com.example.appendagetransfer.remote.ResponseClassifier;
import com.example.appendagetransfer.remote.RestArchiveApi;
import com.example.appendagetransfer.report.JobReportWriter;
import com.example.appendagetransfer.report.ReportSyncer;
import com.example.appendagetransfer.report.S3ReportSyncer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Upload and download operations for the appendages of a shot or asset job.
 * <p>
 * Every operation comes in two forms: a blocking call returning the {@link JobResult},
 * and a {@code start...} call returning a {@link TransferRun} that streams progress
 * events and can be cancelled. Problems with local input (missing path, unreadable
 * preview) are thrown before anything is sent; per-unit failures are collected in the
 * result; a missing job or rejected session aborts the operation with
 * {@link JobAbortedException}.
 */
public class JobBuilder implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobBuilder.class);

    private final ArchiveApi api;
    private final TransferConfig config;
    private final FolderWalker walker;
    private final PreviewPolicy previewPolicy;
    private final TransferEngine engine;
    private final StatusPoller poller;
    private final ReportSyncer reportSyncer;
    private final JobReportWriter reportWriter;

    public JobBuilder(ArchiveApi api, TransferConfig config) {
        this(api, config, syncerFor(config));
    }

    JobBuilder(ArchiveApi api, TransferConfig config, ReportSyncer reportSyncer) {
        this.api = api;
        this.config = config;
        this.walker = new FolderWalker(config);
        this.previewPolicy = new PreviewPolicy(new MediaDetector(new Tika()));
        this.engine = new TransferEngine(config);
        this.poller = new StatusPoller(api, config);
        this.reportSyncer = reportSyncer;
        this.reportWriter = config.reportDirectory()
                .map(directory -> new JobReportWriter(null, directory, reportSyncer))
                .orElse(null);
    }

    /**
     * Builder talking to the archive's REST surface through an authenticated session.
     */
    public static JobBuilder overSession(ArchiveSession session, TransferConfig config) {
        ResponseClassifier classifier = new ResponseClassifier(config.transientStatusCodes(), new ObjectMapper());
        return new JobBuilder(new RestArchiveApi(session, classifier, config.appendageMessage(), config.statusId()),
                config);
    }

    private static ReportSyncer syncerFor(TransferConfig config) {
        if (!config.s3SyncEnabled()) {
            return ReportSyncer.noop();
        }
        return new S3ReportSyncer(
                config.reportDirectory().orElseThrow(),
                config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(""),
                config.s3Region());
    }

    // uploads

    public JobResult uploadFile(JobRef job, Path localPath, boolean createPreview, Path previewPath)
            throws ArchiveException, InterruptedException {
        return startUploadFile(job, localPath, createPreview, previewPath).await();
    }

    public TransferRun startUploadFile(JobRef job, Path localPath, boolean createPreview, Path previewPath)
            throws LocalIoException, InvalidPreviewSourceException {
        PreviewDirective preview = previewPolicy.resolve(createPreview, previewPath);
        UnitSource source = walker.singleFile(localPath);
        return launch("uploadFile", job, () -> source, upload(job, preview, preview), true);
    }

    public JobResult uploadFolder(JobRef job, Path localRoot, boolean createPreview, Path previewPath)
            throws ArchiveException, InterruptedException {
        return startUploadFolder(job, localRoot, createPreview, previewPath).await();
    }

    /**
     * Uploads a directory tree. The explicit preview, if any, is attached to the root folder;
     * descendants get server-generated previews when {@code createPreview} is set.
     */
    public TransferRun startUploadFolder(JobRef job, Path localRoot, boolean createPreview, Path previewPath)
            throws LocalIoException, InvalidPreviewSourceException {
        PreviewDirective rootPreview = previewPolicy.resolve(createPreview, previewPath);
        PreviewDirective descendantPreview = previewPolicy.forDescendant(createPreview);
        if (!Files.isDirectory(localRoot)) {
            throw new LocalIoException(localRoot, "Not a directory");
        }
        UnitSource source = walker.walk(localRoot, AppendageType.FOLDER);
        return launch("uploadFolder", job, () -> source, upload(job, rootPreview, descendantPreview), true);
    }

    public JobResult uploadImageSequence(JobRef job, List<Path> frames, boolean createPreview, Path previewPath)
            throws ArchiveException, InterruptedException {
        return startUploadImageSequence(job, frames, createPreview, previewPath).await();
    }

    /**
     * Uploads frame files as one image-sequence appendage. Frames that do not form a
     * consistent sequence are uploaded as separate files and reported as a diagnostic.
     */
    public TransferRun startUploadImageSequence(JobRef job, List<Path> frames, boolean createPreview,
                                                Path previewPath)
            throws LocalIoException, InvalidPreviewSourceException {
        PreviewDirective preview = previewPolicy.resolve(createPreview, previewPath);
        UnitSource source = walker.imageSequence(frames);
        return launch("uploadImageSequence", job, () -> source, upload(job, preview, preview), true);
    }

    /**
     * Attaches or replaces the preview of an existing appendage.
     */
    public UnitResult uploadPreview(JobRef job, long appendageId, Path previewPath)
            throws ArchiveException, InterruptedException {
        return startUploadPreview(job, appendageId, previewPath).await().root();
    }

    public TransferRun startUploadPreview(JobRef job, long appendageId, Path previewPath)
            throws InvalidPreviewSourceException {
        PreviewDirective preview = previewPolicy.clientSupplied(previewPath);
        UnitOperation operation = (unit, parentId, progress) -> {
            api.uploadPreview(job, unit.remoteId(), preview.path(), preview.contentType());
            return new UnitOperation.Completion(unit.remoteId(), UnitStatus.TRANSFERRED);
        };
        return launch("uploadPreview", job, () -> {
            Appendage target = fetch(job, appendageId);
            TransferUnit unit = new TransferUnit(0, TransferUnit.NO_PARENT, target.fileName(), target.fileName(),
                    target.type(), previewPath, target.id(), sizeOf(previewPath), List.of());
            return UnitSource.of(List.of(unit), List.of());
        }, operation, false);
    }

    // downloads

    public UnitResult downloadFile(JobRef job, long appendageId, Path destination)
            throws ArchiveException, InterruptedException {
        return downloadFile(job, appendageId, destination, FileVersion.ORIGINAL);
    }

    public UnitResult downloadFile(JobRef job, long appendageId, Path destination, FileVersion version)
            throws ArchiveException, InterruptedException {
        return startDownloadFile(job, appendageId, destination, version).await().root();
    }

    /**
     * Downloads one file appendage to {@code destination}, which must not exist yet.
     */
    public TransferRun startDownloadFile(JobRef job, long appendageId, Path destination, FileVersion version)
            throws LocalIoException {
        if (Files.exists(destination)) {
            throw new LocalIoException(destination, "Destination already exists");
        }
        return launch("downloadFile", job, () -> {
            Appendage file = fetchDownloadable(job, appendageId, AppendageType.FILE, version);
            TransferUnit unit = new TransferUnit(0, TransferUnit.NO_PARENT, file.fileName(), file.fileName(),
                    AppendageType.FILE, destination, file.id(), file.size(), List.of());
            return UnitSource.of(List.of(unit), List.of());
        }, new DownloadOperation(api, job, version, false), false);
    }

    public JobResult downloadFolder(JobRef job, long appendageId, Path destinationRoot)
            throws ArchiveException, InterruptedException {
        return startDownloadFolder(job, appendageId, destinationRoot).await();
    }

    /**
     * Recreates a remote folder as {@code destinationRoot/<folder name>}. Files already
     * present with the expected size are skipped, so an interrupted download can be repeated.
     */
    public TransferRun startDownloadFolder(JobRef job, long appendageId, Path destinationRoot)
            throws LocalIoException {
        requireDirectoryOrAbsent(destinationRoot);
        return launch("downloadFolder", job, () -> {
            Appendage folder = fetchDownloadable(job, appendageId, AppendageType.FOLDER, FileVersion.ORIGINAL);
            Path rootPath = DownloadOperation.resolveInside(destinationRoot, folder.fileName());
            return new RemoteTreeWalker(api, job, config.retryPolicy(), folder, rootPath);
        }, new DownloadOperation(api, job, FileVersion.ORIGINAL, true), false);
    }

    public JobResult downloadImageSequence(JobRef job, long appendageId, Path destinationFolder)
            throws ArchiveException, InterruptedException {
        return startDownloadImageSequence(job, appendageId, destinationFolder).await();
    }

    /**
     * Writes the frames of an image sequence into {@code destinationFolder}, skipping frames
     * that are already there.
     */
    public TransferRun startDownloadImageSequence(JobRef job, long appendageId, Path destinationFolder)
            throws LocalIoException {
        requireDirectoryOrAbsent(destinationFolder);
        return launch("downloadImageSequence", job, () -> {
            Appendage sequence = fetchDownloadable(job, appendageId, AppendageType.IMAGE_SEQUENCE,
                    FileVersion.ORIGINAL);
            List<String> frames = config.retryPolicy().call("list frames of " + appendageId,
                    () -> api.listFrameNames(job, appendageId));
            TransferUnit unit = new TransferUnit(0, TransferUnit.NO_PARENT, sequence.fileName(),
                    sequence.fileName(), AppendageType.IMAGE_SEQUENCE, destinationFolder, sequence.id(),
                    sequence.size(), frames);
            return UnitSource.of(List.of(unit), List.of());
        }, new DownloadOperation(api, job, FileVersion.ORIGINAL, true), false);
    }

    @Override
    public void close() {
        reportSyncer.close();
    }

    private UnitOperation upload(JobRef job, PreviewDirective rootPreview, PreviewDirective descendantPreview) {
        return new UploadOperation(api, job, rootPreview, descendantPreview, config.sequenceFps());
    }

    private TransferRun launch(String operation,
                               JobRef job,
                               SourceFactory sources,
                               UnitOperation unitOperation,
                               boolean pollsOnline) {
        LOGGER.info("Starting {} on {}", operation, job);
        TransferRun run = new TransferRun(operation, job);
        return run.start(current -> {
            Instant startedAt = Instant.now();
            try {
                config.retryPolicy().call("check " + job, () -> {
                    api.checkJob(job);
                    return null;
                });
            } catch (RemoteException ex) {
                JobResult empty = new JobResult(operation, job.toString(), List.of(), List.of(), false, startedAt,
                        Instant.now());
                throw new JobAbortedException(ex, empty);
            }

            UnitSource source = sources.open();
            JobResult result;
            try {
                result = engine.execute(operation, job, source, unitOperation, current);
            } catch (JobAbortedException ex) {
                writeReport(ex.getPartialResult());
                throw ex;
            }
            if (pollsOnline && config.awaitOnline() && !current.isCancelled()) {
                result = awaitOnline(job, result, current);
            }
            writeReport(result);
            return result;
        });
    }

    /**
     * Replaces TRANSFERRED with ONLINE or STILL_PROCESSING for every unit the poller could observe.
     */
    private JobResult awaitOnline(JobRef job, JobResult result, TransferRun run) throws InterruptedException {
        List<Long> ids = result.units().stream()
                .filter(unit -> unit.getStatus() == UnitStatus.TRANSFERRED)
                .map(UnitResult::getAppendageId)
                .toList();
        if (ids.isEmpty()) {
            return result;
        }
        Map<Long, StatusPoller.Outcome> outcomes = poller.awaitAllOnline(job, ids, config.onlineTimeout(),
                run.token());
        List<UnitResult> units = new ArrayList<>();
        for (int index = 0; index < result.units().size(); index++) {
            UnitResult unit = result.units().get(index);
            StatusPoller.Outcome outcome = unit.getStatus() == UnitStatus.TRANSFERRED
                    ? outcomes.get(unit.getAppendageId()) : null;
            if (outcome == null) {
                units.add(unit);
                continue;
            }
            boolean online = outcome == StatusPoller.Outcome.ONLINE;
            units.add(unit.withStatus(online ? UnitStatus.ONLINE : UnitStatus.STILL_PROCESSING));
            run.publish(new TransferEvent(online ? TransferEvent.Kind.ONLINE : TransferEvent.Kind.STILL_PROCESSING,
                    index, unit.getRelativePath(), 0, "appendage " + unit.getAppendageId(), Instant.now()));
        }
        return new JobResult(result.operation(), result.job(), units, result.diagnostics(), result.cancelled(),
                result.startedAt(), Instant.now());
    }

    private Appendage fetch(JobRef job, long appendageId) throws RemoteException, InterruptedException {
        return config.retryPolicy().call("fetch appendage " + appendageId, () -> api.fetchAppendage(job, appendageId));
    }

    private Appendage fetchDownloadable(JobRef job, long appendageId, AppendageType expected, FileVersion version)
            throws RemoteException, InterruptedException {
        Appendage appendage = fetch(job, appendageId);
        boolean derivedVersion = expected == AppendageType.FILE && version != FileVersion.ORIGINAL;
        if (appendage.type() != expected && !derivedVersion) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                    "Appendage " + appendageId + " is a " + appendage.type() + ", not a " + expected);
        }
        if (version == FileVersion.ORIGINAL && expected != AppendageType.FOLDER && !appendage.online()) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.CONFLICT,
                    "Appendage " + appendageId + " is not online yet");
        }
        return appendage;
    }

    private void writeReport(JobResult result) {
        if (reportWriter == null) {
            return;
        }
        try {
            Path report = reportWriter.write(result);
            LOGGER.info("Wrote job report {}", report);
        } catch (IOException ex) {
            LOGGER.warn("Failed to write job report for {}", result.operation(), ex);
        }
    }

    private static void requireDirectoryOrAbsent(Path path) throws LocalIoException {
        if (Files.exists(path) && !Files.isDirectory(path)) {
            throw new LocalIoException(path, "Not a directory");
        }
    }

    private static long sizeOf(Path file) throws LocalIoException {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            throw new LocalIoException(file, ex);
        }
    }

    /**
     * Produces the units of a run once the job has been checked.
     */
    @FunctionalInterface
    private interface SourceFactory {
        UnitSource open() throws ArchiveException, InterruptedException;
    }
}
