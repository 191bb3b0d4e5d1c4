package com.example.syncreconciler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk form of a {@link SyncConfig}. Enums are stored by code, the remote root by its raw value;
 * a payload without one decodes to {@link RemoteHandle#UNDEF}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PersistedSyncConfig(
        @JsonProperty("id") long backupId,
        @JsonProperty("n") String name,
        @JsonProperty("sp") String localPath,
        @JsonProperty("dp") String drivePath,
        @JsonProperty("h") Long remoteRoot,
        @JsonProperty("tp") String remotePath,
        @JsonProperty("en") boolean enabled,
        @JsonProperty("t") int type,
        @JsonProperty("sd") boolean syncDeletions,
        @JsonProperty("fo") boolean forceOverwrite,
        @JsonProperty("ex") List<String> exclusions,
        @JsonProperty("fp") long localFingerprint,
        @JsonProperty("le") int lastError
) {
    static PersistedSyncConfig from(SyncConfig config) {
        return new PersistedSyncConfig(
                config.backupId(),
                config.name(),
                config.localPath(),
                config.drivePath(),
                config.remoteRoot().value(),
                config.remotePath(),
                config.enabled(),
                config.type().code(),
                config.syncDeletions(),
                config.forceOverwrite(),
                config.exclusions(),
                config.localFingerprint(),
                config.lastError().code()
        );
    }

    SyncConfig toConfig() {
        return new SyncConfig(
                backupId,
                name,
                localPath,
                drivePath,
                remoteRoot == null ? RemoteHandle.UNDEF : RemoteHandle.of(remoteRoot),
                remotePath,
                enabled,
                SyncType.fromCode(type),
                syncDeletions,
                forceOverwrite,
                exclusions,
                localFingerprint,
                SyncError.fromCode(lastError)
        );
    }
}
