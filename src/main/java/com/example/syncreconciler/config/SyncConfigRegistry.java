package com.example.syncreconciler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns one {@link ConfigStore} per drive and keeps track of which of them need writing.
 *
 * <p>The internal drive is keyed by the empty drive path. Add, change and remove
 * notifications are forwarded to the downstream observer; dirty notifications are absorbed
 * here and acted on by {@link #flush()}.
 */
public final class SyncConfigRegistry implements ConfigStoreObserver, AutoCloseable {
    public static final String INTERNAL_DRIVE = "";

    private static final Logger LOGGER = LoggerFactory.getLogger(SyncConfigRegistry.class);

    private final ConfigIOContext io;
    private final ConfigStoreObserver downstream;
    private final int maxSlots;
    private final Map<String, ConfigStore> stores = new LinkedHashMap<>();
    private final Set<ConfigStore> dirtyStores = new LinkedHashSet<>();

    public SyncConfigRegistry(ConfigIOContext io) {
        this(io, null, ConfigStore.DEFAULT_MAX_SLOTS);
    }

    public SyncConfigRegistry(ConfigIOContext io, ConfigStoreObserver downstream, int maxSlots) {
        this.io = io;
        this.downstream = downstream;
        this.maxSlots = maxSlots;
    }

    /**
     * Opens the store for {@code drivePath} and loads it from {@code dbPath}. A store that was
     * never written is kept, empty. A store that exists but cannot be read is discarded.
     */
    public ConfigResult open(String drivePath, String dbPath) {
        String key = drivePath == null ? INTERNAL_DRIVE : drivePath;
        if (stores.containsKey(key)) {
            throw new IllegalStateException("A config store is already open for drive '" + key + "'");
        }
        ConfigStore store = new ConfigStore(dbPath, key, this, new SyncConfigCodec(), maxSlots);
        ConfigResult result = store.read(io);
        if (result == ConfigResult.READ_ERROR) {
            LOGGER.warn("Discarding unreadable config store {} for drive '{}'", dbPath, key);
            store.close();
            return result;
        }
        stores.put(key, store);
        return result;
    }

    public Optional<ConfigStore> store(String drivePath) {
        return Optional.ofNullable(stores.get(drivePath));
    }

    public List<ConfigStore> stores() {
        return List.copyOf(stores.values());
    }

    /**
     * Configs of every open store, internal drive first.
     */
    public List<SyncConfig> configs() {
        List<SyncConfig> result = new ArrayList<>();
        for (ConfigStore store : stores.values()) {
            result.addAll(store.configs());
        }
        return result;
    }

    public boolean hasDirtyStores() {
        return !dirtyStores.isEmpty();
    }

    /**
     * Writes every dirty store. Stores that fail to write stay dirty.
     *
     * @return the first failure, or {@link ConfigResult#OK}
     */
    public ConfigResult flush() {
        ConfigResult outcome = ConfigResult.OK;
        for (ConfigStore store : new ArrayList<>(dirtyStores)) {
            ConfigResult result = store.write(io);
            if (result == ConfigResult.OK) {
                dirtyStores.remove(store);
            } else if (outcome == ConfigResult.OK) {
                outcome = result;
            }
        }
        return outcome;
    }

    /**
     * Flushes and closes the store for {@code drivePath}.
     */
    public ConfigResult close(String drivePath) {
        ConfigStore store = stores.get(drivePath);
        if (store == null) {
            return ConfigResult.NOT_FOUND;
        }
        ConfigResult result = ConfigResult.OK;
        if (store.dirty()) {
            result = store.write(io);
        }
        stores.remove(drivePath);
        dirtyStores.remove(store);
        store.close();
        return result;
    }

    public ConfigResult closeAll() {
        ConfigResult outcome = ConfigResult.OK;
        for (String drivePath : new ArrayList<>(stores.keySet())) {
            ConfigResult result = close(drivePath);
            if (result != ConfigResult.OK && outcome == ConfigResult.OK) {
                outcome = result;
            }
        }
        return outcome;
    }

    @Override
    public void close() {
        ConfigResult result = closeAll();
        if (result != ConfigResult.OK) {
            LOGGER.warn("Some config stores could not be written on close: {}", result);
        }
    }

    @Override
    public void onAdd(ConfigStore store, SyncConfig config) {
        if (downstream != null) {
            downstream.onAdd(store, config);
        }
    }

    @Override
    public void onChange(ConfigStore store, SyncConfig previous, SyncConfig current) {
        if (downstream != null) {
            downstream.onChange(store, previous, current);
        }
    }

    @Override
    public void onDirty(ConfigStore store) {
        dirtyStores.add(store);
    }

    @Override
    public void onRemove(ConfigStore store, SyncConfig config) {
        if (downstream != null) {
            downstream.onRemove(store, config);
        }
    }
}
