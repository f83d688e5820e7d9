package com.example.appendagetransfer.model;

public enum FileVersion {
    ORIGINAL(1),
    PREVIEW(2),
    THUMB(3);

    private final int code;

    FileVersion(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
