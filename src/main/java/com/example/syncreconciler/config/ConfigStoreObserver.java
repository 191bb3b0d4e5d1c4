package com.example.syncreconciler.config;

/**
 * Receives {@link ConfigStore} change notifications synchronously, before the mutating call returns.
 */
public interface ConfigStoreObserver {
    void onAdd(ConfigStore store, SyncConfig config);

    void onChange(ConfigStore store, SyncConfig previous, SyncConfig current);

    void onDirty(ConfigStore store);

    void onRemove(ConfigStore store, SyncConfig config);
}
