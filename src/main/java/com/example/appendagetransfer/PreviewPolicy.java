package com.example.appendagetransfer;

import com.example.appendagetransfer.error.InvalidPreviewSourceException;
import com.example.appendagetransfer.model.MediaKind;
import com.example.appendagetransfer.model.PreviewDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides how the preview of an appendage is produced. An explicit preview file always
 * wins; otherwise the server derives one when asked to. The decision depends only on the
 * arguments and the preview file itself.
 */
public final class PreviewPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(PreviewPolicy.class);

    private final MediaDetector detector;

    public PreviewPolicy(MediaDetector detector) {
        this.detector = detector;
    }

    public PreviewDirective resolve(boolean createPreview, Path previewPath) throws InvalidPreviewSourceException {
        if (previewPath != null) {
            return clientSupplied(previewPath);
        }
        return createPreview ? PreviewDirective.SERVER_GENERATED : PreviewDirective.NONE;
    }

    /**
     * Directive for units below the root of a folder upload. An explicit preview belongs to
     * the root appendage only; descendants keep the server-generated preview if one was asked for.
     */
    public PreviewDirective forDescendant(boolean createPreview) {
        return createPreview ? PreviewDirective.SERVER_GENERATED : PreviewDirective.NONE;
    }

    public PreviewDirective clientSupplied(Path previewPath) throws InvalidPreviewSourceException {
        if (!Files.exists(previewPath)) {
            throw new InvalidPreviewSourceException(previewPath, "file does not exist");
        }
        if (!Files.isRegularFile(previewPath)) {
            throw new InvalidPreviewSourceException(previewPath, "not a regular file");
        }
        if (!Files.isReadable(previewPath)) {
            throw new InvalidPreviewSourceException(previewPath, "file is not readable");
        }
        String contentType;
        try {
            contentType = detector.detectType(previewPath);
        } catch (IOException ex) {
            throw new InvalidPreviewSourceException(previewPath, "cannot be read: " + ex.getMessage());
        }
        MediaKind kind = MediaDetector.kindOf(contentType);
        if (kind == MediaKind.UNKNOWN) {
            LOGGER.warn("Preview {} is not a recognized image, video or audio file; the archive may discard it.",
                    previewPath);
        }
        return PreviewDirective.clientSupplied(previewPath, contentType, kind);
    }
}
