package com.example.appendagetransfer;

import com.example.appendagetransfer.model.MediaKind;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Detects the MIME type of a local file from its content and name.
 */
public class MediaDetector {
    private final Tika tika;

    public MediaDetector(Tika tika) {
        this.tika = tika;
    }

    /**
     * MIME type of the file, {@code application/octet-stream} when nothing more specific is recognized.
     */
    public String detectType(Path path) throws IOException {
        return tika.detect(path);
    }

    public static MediaKind kindOf(String mimeType) {
        MediaType mediaType = mimeType == null ? null : MediaType.parse(mimeType);
        if (mediaType == null) {
            return MediaKind.UNKNOWN;
        }
        switch (mediaType.getType()) {
            case "image":
                return MediaKind.IMAGE;
            case "video":
                return MediaKind.VIDEO;
            case "audio":
                return MediaKind.AUDIO;
            default:
                return MediaKind.UNKNOWN;
        }
    }
}
