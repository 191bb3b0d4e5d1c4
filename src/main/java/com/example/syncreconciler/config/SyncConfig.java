package com.example.syncreconciler.config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one configured sync or backup.
 *
 * <p>{@code backupId} is the primary key. {@code drivePath} is empty for syncs on the
 * internal drive and names the drive root for backups on external drives.
 */
public record SyncConfig(
        long backupId,
        String name,
        String localPath,
        String drivePath,
        RemoteHandle remoteRoot,
        String remotePath,
        boolean enabled,
        SyncType type,
        boolean syncDeletions,
        boolean forceOverwrite,
        List<String> exclusions,
        long localFingerprint,
        SyncError lastError
) {
    public SyncConfig {
        Objects.requireNonNull(localPath, "localPath");
        if (localPath.isEmpty()) {
            throw new IllegalArgumentException("Local path must not be empty.");
        }
        Objects.requireNonNull(type, "type");
        if (type == SyncType.TWO_WAY && (!syncDeletions || forceOverwrite)) {
            throw new IllegalArgumentException(
                    "Two-way syncs must propagate deletions and must not force overwrites.");
        }
        name = name == null ? "" : name;
        drivePath = drivePath == null ? "" : drivePath;
        remoteRoot = remoteRoot == null ? RemoteHandle.UNDEF : remoteRoot;
        remotePath = remotePath == null ? "" : remotePath;
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        lastError = lastError == null ? SyncError.NO_SYNC_ERROR : lastError;
    }

    /**
     * An enabled two-way sync with no exclusions and no recorded error.
     */
    public static SyncConfig of(long backupId, String localPath, RemoteHandle remoteRoot) {
        return new SyncConfig(backupId, "", localPath, "", remoteRoot, "", true,
                SyncType.TWO_WAY, true, false, List.of(), 0L, SyncError.NO_SYNC_ERROR);
    }

    public boolean isUpSync() {
        return type == SyncType.TWO_WAY || type == SyncType.UP;
    }

    public boolean isDownSync() {
        return type == SyncType.TWO_WAY || type == SyncType.DOWN;
    }

    public boolean isExternal() {
        return !drivePath.isEmpty();
    }

    public SyncConfig withEnabled(boolean value) {
        return new SyncConfig(backupId, name, localPath, drivePath, remoteRoot, remotePath, value,
                type, syncDeletions, forceOverwrite, exclusions, localFingerprint, lastError);
    }

    public SyncConfig withRemoteRoot(RemoteHandle value) {
        return new SyncConfig(backupId, name, localPath, drivePath, value, remotePath, enabled,
                type, syncDeletions, forceOverwrite, exclusions, localFingerprint, lastError);
    }

    public SyncConfig withLastError(SyncError value) {
        return new SyncConfig(backupId, name, localPath, drivePath, remoteRoot, remotePath, enabled,
                type, syncDeletions, forceOverwrite, exclusions, localFingerprint, value);
    }

    public SyncConfig withLocalFingerprint(long value) {
        return new SyncConfig(backupId, name, localPath, drivePath, remoteRoot, remotePath, enabled,
                type, syncDeletions, forceOverwrite, exclusions, value, lastError);
    }

    public SyncConfig withType(SyncType value, boolean deletions, boolean overwrite) {
        return new SyncConfig(backupId, name, localPath, drivePath, remoteRoot, remotePath, enabled,
                value, deletions, overwrite, exclusions, localFingerprint, lastError);
    }

    public SyncConfig withExclusions(List<String> value) {
        return new SyncConfig(backupId, name, localPath, drivePath, remoteRoot, remotePath, enabled,
                type, syncDeletions, forceOverwrite, value, localFingerprint, lastError);
    }
}
