package com.example.appendagetransfer.model;

import java.nio.file.Path;

/**
 * Resolved preview handling for one appendage. For a client preview {@code contentType}
 * is the MIME type detected from the file and sent with its bytes.
 */
public record PreviewDirective(
        Source source,
        Path path,
        String contentType,
        MediaKind mediaKind
) {
    public enum Source {
        NONE,
        SERVER_GENERATED,
        CLIENT_SUPPLIED
    }

    public static final PreviewDirective NONE = new PreviewDirective(Source.NONE, null, null, MediaKind.UNKNOWN);
    public static final PreviewDirective SERVER_GENERATED =
            new PreviewDirective(Source.SERVER_GENERATED, null, null, MediaKind.UNKNOWN);

    public static PreviewDirective clientSupplied(Path path, String contentType, MediaKind mediaKind) {
        return new PreviewDirective(Source.CLIENT_SUPPLIED, path, contentType, mediaKind);
    }

    /**
     * True when the server is asked to derive the preview from the uploaded media.
     */
    public boolean serverGenerated() {
        return source == Source.SERVER_GENERATED;
    }

    public boolean clientSupplied() {
        return source == Source.CLIENT_SUPPLIED;
    }
}
