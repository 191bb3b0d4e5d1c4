package com.example.syncreconciler.fs;

/**
 * Decides whether a live path takes part in syncing at all.
 */
@FunctionalInterface
public interface SyncablePolicy {
    boolean isSyncable(String path);

    /**
     * Policy used when the host has no exclusions.
     */
    SyncablePolicy ALL = path -> true;
}
