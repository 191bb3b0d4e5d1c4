package com.example.syncreconciler;

import com.example.syncreconciler.config.SyncConfig;
import com.example.syncreconciler.tree.TrackedTree;

import java.util.Optional;

/**
 * Supplies the tracked tree the sync engine rebuilt for a config, if it has one.
 */
@FunctionalInterface
public interface TrackedTreeSource {
    Optional<TrackedTree> treeFor(SyncConfig config);
}
