package com.example.syncreconciler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory table of the sync configs persisted in one store, keyed by backup id with a
 * secondary index by remote root.
 *
 * <p>Every mutation notifies the {@link ConfigStoreObserver} before returning. Mutations
 * that change persisted state also mark the store dirty and fire {@code onDirty}; loading
 * from disk never does. Callers serialize access to one store.
 */
public final class ConfigStore implements AutoCloseable {
    public static final int DEFAULT_MAX_SLOTS = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigStore.class);

    private final String dbPath;
    private final String drivePath;
    private final ConfigStoreObserver observer;
    private final SyncConfigCodec codec;
    private final int maxSlots;
    private final Map<Long, SyncConfig> configs = new LinkedHashMap<>();
    private final Map<RemoteHandle, Long> byRemoteRoot = new HashMap<>();
    private int slot;
    private boolean dirty;

    public ConfigStore(String dbPath, String drivePath, ConfigStoreObserver observer) {
        this(dbPath, drivePath, observer, new SyncConfigCodec(), DEFAULT_MAX_SLOTS);
    }

    public ConfigStore(String dbPath,
                       String drivePath,
                       ConfigStoreObserver observer,
                       SyncConfigCodec codec,
                       int maxSlots) {
        if (maxSlots < 2) {
            throw new IllegalArgumentException("A store needs at least two slots, got " + maxSlots);
        }
        this.dbPath = Objects.requireNonNull(dbPath, "dbPath");
        this.drivePath = drivePath == null ? "" : drivePath;
        this.observer = Objects.requireNonNull(observer, "observer");
        this.codec = codec;
        this.maxSlots = maxSlots;
    }

    /**
     * Inserts or updates {@code config}. Re-adding an identical config is a silent no-op.
     *
     * @return the stored config
     */
    public SyncConfig add(SyncConfig config) {
        if (put(config)) {
            markDirty();
        }
        return configs.get(config.backupId());
    }

    public Optional<SyncConfig> get(long backupId) {
        return Optional.ofNullable(configs.get(backupId));
    }

    public Optional<SyncConfig> getByRemoteRoot(RemoteHandle remoteRoot) {
        Long backupId = byRemoteRoot.get(remoteRoot);
        return backupId == null ? Optional.empty() : get(backupId);
    }

    public ConfigResult remove(long backupId) {
        if (!configs.containsKey(backupId)) {
            return ConfigResult.NOT_FOUND;
        }
        drop(backupId);
        markDirty();
        return ConfigResult.OK;
    }

    public ConfigResult removeByRemoteRoot(RemoteHandle remoteRoot) {
        Long backupId = byRemoteRoot.get(remoteRoot);
        return backupId == null ? ConfigResult.NOT_FOUND : remove(backupId);
    }

    /**
     * Removes every config in insertion order, then fires a single dirty notification.
     */
    public void clear() {
        if (configs.isEmpty()) {
            return;
        }
        dropAll();
        markDirty();
    }

    /**
     * Configs in insertion order.
     */
    public List<SyncConfig> configs() {
        return List.copyOf(configs.values());
    }

    public boolean dirty() {
        return dirty;
    }

    public String dbPath() {
        return dbPath;
    }

    public String drivePath() {
        return drivePath;
    }

    /**
     * Slot the next {@link #write(ConfigIOContext)} will target.
     */
    public int slot() {
        return slot;
    }

    /**
     * Replaces the table with the newest readable slot.
     *
     * @return {@link ConfigResult#NOT_FOUND} if nothing was ever written,
     * {@link ConfigResult#READ_ERROR} if no slot could be read
     */
    public ConfigResult read(ConfigIOContext io) {
        List<Integer> slots;
        try {
            slots = io.listSlots(dbPath);
        } catch (NoSuchFileException ex) {
            LOGGER.debug("No config store directory at {}", dbPath);
            return ConfigResult.NOT_FOUND;
        } catch (IOException ex) {
            LOGGER.warn("Unable to list config slots in {}", dbPath, ex);
            return ConfigResult.READ_ERROR;
        }
        if (slots.isEmpty()) {
            return ConfigResult.NOT_FOUND;
        }

        for (int candidate : slots) {
            List<SyncConfig> loaded;
            try {
                loaded = codec.decode(io.read(dbPath, candidate));
            } catch (IOException ex) {
                LOGGER.warn("Skipping unreadable config slot {} in {}", candidate, dbPath, ex);
                continue;
            }
            load(loaded);
            slot = (candidate + 1) % maxSlots;
            dirty = false;
            LOGGER.info("Loaded {} sync configs from slot {} of {}", loaded.size(), candidate, dbPath);
            return ConfigResult.OK;
        }
        LOGGER.warn("No readable config slot in {}", dbPath);
        return ConfigResult.READ_ERROR;
    }

    /**
     * Writes every config to the current slot and advances to the next one on success.
     * A failed write leaves the slot and the dirty flag untouched.
     */
    public ConfigResult write(ConfigIOContext io) {
        try {
            io.write(dbPath, codec.encode(configs.values()), slot);
        } catch (IOException ex) {
            LOGGER.warn("Unable to write config slot {} in {}", slot, dbPath, ex);
            return ConfigResult.WRITE_ERROR;
        }
        LOGGER.info("Wrote {} sync configs to slot {} of {}", configs.size(), slot, dbPath);
        slot = (slot + 1) % maxSlots;
        dirty = false;
        return ConfigResult.OK;
    }

    /**
     * Fires a removal notification for every remaining config. Never marks the store dirty.
     */
    @Override
    public void close() {
        dropAll();
    }

    private void load(List<SyncConfig> loaded) {
        Map<Long, SyncConfig> incoming = new LinkedHashMap<>();
        for (SyncConfig config : loaded) {
            incoming.put(config.backupId(), config);
        }
        for (Long backupId : new ArrayList<>(configs.keySet())) {
            if (!incoming.containsKey(backupId)) {
                drop(backupId);
            }
        }
        for (SyncConfig config : incoming.values()) {
            put(config);
        }
    }

    /**
     * Returns true if the table changed.
     */
    private boolean put(SyncConfig config) {
        SyncConfig previous = configs.get(config.backupId());
        if (config.equals(previous)) {
            return false;
        }
        configs.put(config.backupId(), config);
        if (previous != null) {
            unmapRemoteRoot(previous);
        }
        if (!config.remoteRoot().isUndef()) {
            byRemoteRoot.put(config.remoteRoot(), config.backupId());
        }
        if (previous == null) {
            observer.onAdd(this, config);
        } else {
            observer.onChange(this, previous, config);
        }
        return true;
    }

    private void drop(long backupId) {
        SyncConfig removed = configs.remove(backupId);
        unmapRemoteRoot(removed);
        observer.onRemove(this, removed);
    }

    private void dropAll() {
        for (Long backupId : new ArrayList<>(configs.keySet())) {
            drop(backupId);
        }
    }

    private void unmapRemoteRoot(SyncConfig config) {
        if (!config.remoteRoot().isUndef()) {
            byRemoteRoot.remove(config.remoteRoot(), config.backupId());
        }
    }

    private void markDirty() {
        dirty = true;
        observer.onDirty(this);
    }
}
