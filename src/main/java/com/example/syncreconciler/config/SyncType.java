package com.example.syncreconciler.config;

/**
 * Sync direction, persisted by numeric code.
 */
public enum SyncType {
    UP(1),
    DOWN(2),
    TWO_WAY(3);

    private final int code;

    SyncType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static SyncType fromCode(int code) {
        for (SyncType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sync type code: " + code);
    }
}
