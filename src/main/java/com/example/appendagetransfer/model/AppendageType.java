package com.example.appendagetransfer.model;

/**
 * Kind of media unit an appendage holds. Fixed when the appendage is created.
 */
public enum AppendageType {
    FILE(1),
    FOLDER(2),
    IMAGE_SEQUENCE(3);

    private final int code;

    AppendageType(int code) {
        this.code = code;
    }

    /**
     * Numeric value used by the archive's wire format.
     */
    public int code() {
        return code;
    }

    public static AppendageType fromCode(int code) {
        for (AppendageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown appendage type code: " + code);
    }
}
