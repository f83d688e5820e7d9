package com.example.appendagetransfer.model;

/**
 * Media category of an upload or preview as recognized by content detection.
 */
public enum MediaKind {
    UNKNOWN(0),
    IMAGE(1),
    VIDEO(2),
    AUDIO(3);

    private final int code;

    MediaKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static MediaKind fromCode(int code) {
        for (MediaKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
