package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.PreviewDirective;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitStatus;
import com.example.appendagetransfer.remote.ArchiveApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Creates the appendage for a local unit, sends its bytes and attaches a client preview.
 */
final class UploadOperation implements UnitOperation {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadOperation.class);

    private final ArchiveApi api;
    private final JobRef job;
    private final PreviewDirective rootPreview;
    private final PreviewDirective descendantPreview;
    private final double fps;

    UploadOperation(ArchiveApi api, JobRef job, PreviewDirective rootPreview, PreviewDirective descendantPreview,
                    double fps) {
        this.api = api;
        this.job = job;
        this.rootPreview = rootPreview;
        this.descendantPreview = descendantPreview;
        this.fps = fps;
    }

    @Override
    public Completion perform(TransferUnit unit, long parentRemoteId, UnitProgress progress)
            throws ArchiveException {
        PreviewDirective preview = unit.isRoot() ? rootPreview : descendantPreview;
        if (!progress.hasRemoteId()) {
            long id = unit.type() == AppendageType.IMAGE_SEQUENCE
                    ? api.createImageSequence(job, parentRemoteId, unit.name(), fps)
                    : api.createAppendage(job, parentRemoteId, unit.type(), unit.name());
            progress.remoteId(id);
            LOGGER.debug("Created {} appendage {} for {}", unit.type(), id, unit.relativePath());
        }
        long id = progress.remoteId();

        if (unit.type() == AppendageType.FILE && !progress.contentDone()) {
            api.uploadContent(job, id, unit.localPath(), preview.serverGenerated());
            progress.markContentDone();
        } else if (unit.type() == AppendageType.IMAGE_SEQUENCE && !progress.contentDone()) {
            uploadFrames(unit, id, preview, progress);
            progress.markContentDone();
        }

        if (preview.clientSupplied() && !progress.previewDone()) {
            api.uploadPreview(job, id, preview.path(), preview.contentType());
            progress.markPreviewDone();
        }
        return new Completion(id, UnitStatus.TRANSFERRED);
    }

    /**
     * Announces the frames once, then sends whichever frame the archive asks for until it
     * reports the sequence complete. A retry reuses the upload job and resumes where it stopped.
     */
    private void uploadFrames(TransferUnit unit, long id, PreviewDirective preview, UnitProgress progress)
            throws ArchiveException {
        if (progress.uploadJobId() == null) {
            progress.uploadJobId(api.initImageSequenceUpload(job, id, unit.members(), preview.serverGenerated()));
            LOGGER.debug("Opened upload job {} for {} frames of {}", progress.uploadJobId(), unit.members().size(),
                    unit.relativePath());
        }
        String uploadJobId = progress.uploadJobId();
        Set<String> frames = Set.copyOf(unit.members());
        Optional<String> next = api.nextPendingFrame(uploadJobId);
        while (next.isPresent()) {
            String frame = next.get();
            if (!frames.contains(frame)) {
                throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                        "Archive requested frame '" + frame + "' which is not part of " + unit.relativePath());
            }
            next = api.uploadFrame(uploadJobId, frame, unit.localPath().resolve(frame));
        }
    }
}
