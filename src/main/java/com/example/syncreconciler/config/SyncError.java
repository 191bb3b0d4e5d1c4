package com.example.syncreconciler.config;

/**
 * Last error recorded against a sync. Codes are part of the persisted format.
 */
public enum SyncError {
    NO_SYNC_ERROR(0),
    UNKNOWN_ERROR(1),
    LOCAL_PATH_UNAVAILABLE(2),
    REMOTE_NODE_NOT_FOUND(3),
    REMOTE_NODE_MOVED_TO_RUBBISH(4),
    STORAGE_OVERQUOTA(5),
    ACCOUNT_BLOCKED(6),
    LOCAL_FINGERPRINT_MISMATCH(7),
    INITIAL_SCAN_FAILED(8),
    BACKUP_SOURCE_NOT_BELOW_DRIVE(9);

    private final int code;

    SyncError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Unrecognised codes map to {@link #UNKNOWN_ERROR} so newer stores stay readable.
     */
    public static SyncError fromCode(int code) {
        for (SyncError error : values()) {
            if (error.code == code) {
                return error;
            }
        }
        return UNKNOWN_ERROR;
    }
}
