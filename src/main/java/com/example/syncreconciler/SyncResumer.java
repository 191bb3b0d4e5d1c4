package com.example.syncreconciler;

import com.example.syncreconciler.assign.FingerprintGenerator;
import com.example.syncreconciler.assign.IdentityAssigner;
import com.example.syncreconciler.assign.TraversalInterrupt;
import com.example.syncreconciler.config.ConfigCipher;
import com.example.syncreconciler.config.ConfigIOContext;
import com.example.syncreconciler.config.ConfigResult;
import com.example.syncreconciler.config.ConfigStore;
import com.example.syncreconciler.config.SyncConfig;
import com.example.syncreconciler.config.SyncConfigRegistry;
import com.example.syncreconciler.config.SyncError;
import com.example.syncreconciler.fs.ExclusionPolicy;
import com.example.syncreconciler.fs.FileSystemAccess;
import com.example.syncreconciler.fs.LocalFileSystemAccess;
import com.example.syncreconciler.tree.TrackedTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Start-up pass: loads the internal config store, then re-assigns filesystem ids to the
 * tracked tree of every enabled sync.
 *
 * <p>A sync whose assignment comes back incomplete is flagged with
 * {@link SyncError#INITIAL_SCAN_FAILED}; a later complete pass clears that flag again.
 * Changed configs are written back before returning.
 */
public final class SyncResumer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyncResumer.class);

    private final ReconcilerSettings settings;
    private final FileSystemAccess fileSystem;
    private final SyncConfigRegistry registry;
    private final TrackedTreeSource trees;
    private final TraversalInterrupt interrupt;

    /**
     * Resumer over the local filesystem, following symbolic links as {@code settings} ask.
     */
    public SyncResumer(ReconcilerSettings settings, ConfigCipher cipher, TrackedTreeSource trees) {
        this(settings, new LocalFileSystemAccess(settings.followLinks()), cipher, trees);
    }

    /**
     * @throws IllegalArgumentException if {@code fileSystem} does not apply the link policy of
     * {@code settings}
     */
    public SyncResumer(ReconcilerSettings settings,
                       FileSystemAccess fileSystem,
                       ConfigCipher cipher,
                       TrackedTreeSource trees) {
        this(settings,
                fileSystem,
                new SyncConfigRegistry(
                        new ConfigIOContext(cipher, fileSystem, settings.storeName()),
                        null,
                        settings.maxSlots()),
                trees,
                TraversalInterrupt.never());
    }

    SyncResumer(ReconcilerSettings settings,
                FileSystemAccess fileSystem,
                SyncConfigRegistry registry,
                TrackedTreeSource trees,
                TraversalInterrupt interrupt) {
        if (fileSystem.followsLinks() != settings.followLinks()) {
            throw new IllegalArgumentException("Filesystem " + (fileSystem.followsLinks() ? "follows" : "does not follow")
                    + " symbolic links but settings have followLinks=" + settings.followLinks());
        }
        this.settings = settings;
        this.fileSystem = fileSystem;
        this.registry = registry;
        this.trees = trees;
        this.interrupt = interrupt;
    }

    public SyncConfigRegistry registry() {
        return registry;
    }

    public ResumeReport resume() {
        ConfigResult storeResult = ConfigResult.OK;
        if (registry.store(SyncConfigRegistry.INTERNAL_DRIVE).isEmpty()) {
            storeResult = registry.open(SyncConfigRegistry.INTERNAL_DRIVE, settings.storeDirectory());
            if (storeResult == ConfigResult.READ_ERROR) {
                LOGGER.error("Unable to load sync configs from {}", settings.storeDirectory());
                return ResumeReport.storeFailure(storeResult);
            }
        }

        List<ResumeOutcome> outcomes = new ArrayList<>();
        for (ConfigStore store : registry.stores()) {
            for (SyncConfig config : store.configs()) {
                outcomes.add(resume(store, config));
            }
        }

        ConfigResult flushResult = registry.flush();
        if (flushResult != ConfigResult.OK) {
            LOGGER.warn("Unable to persist sync config updates: {}", flushResult);
        }
        LOGGER.info("Resume pass finished for {} syncs.", outcomes.size());
        return new ResumeReport(storeResult, outcomes, flushResult);
    }

    private ResumeOutcome resume(ConfigStore store, SyncConfig config) {
        if (!config.enabled()) {
            return ResumeOutcome.skipped(config.backupId(), "disabled");
        }
        Optional<TrackedTree> tree = trees.treeFor(config);
        if (tree.isEmpty()) {
            return ResumeOutcome.skipped(config.backupId(), "no tracked tree");
        }

        List<String> exclusions = ReconcilerSettingsLoader.mergePatterns(
                settings.defaultExclusions(), config.exclusions());
        IdentityAssigner assigner = new IdentityAssigner(
                fileSystem,
                new ExclusionPolicy(exclusions, fileSystem.separator()),
                new FingerprintGenerator(settings.hashContent()),
                interrupt);
        String debrisPath = fileSystem.join(config.localPath(), settings.debrisFolderName());

        boolean complete = assigner.assign(config.localPath(), tree.get(), debrisPath);
        int assigned = tree.get().reverseIndexSize();
        if (!complete) {
            LOGGER.warn("Identity assignment for sync {} at {} is incomplete.", config.backupId(), config.localPath());
            store.add(config.withLastError(SyncError.INITIAL_SCAN_FAILED));
            return ResumeOutcome.failure(config.backupId(), "identity assignment incomplete", assigned);
        }
        if (config.lastError() == SyncError.INITIAL_SCAN_FAILED) {
            store.add(config.withLastError(SyncError.NO_SYNC_ERROR));
        }
        return ResumeOutcome.success(config.backupId(), assigned);
    }
}
