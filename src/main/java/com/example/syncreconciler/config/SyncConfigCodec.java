package com.example.syncreconciler.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Serializes a store's configs as a JSON array. An empty store encodes as {@code []}.
 */
public class SyncConfigCodec {
    private static final TypeReference<List<PersistedSyncConfig>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public SyncConfigCodec() {
        this(new ObjectMapper());
    }

    public SyncConfigCodec(ObjectMapper mapper) {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
    }

    public byte[] encode(Collection<SyncConfig> configs) throws IOException {
        List<PersistedSyncConfig> persisted = new ArrayList<>(configs.size());
        for (SyncConfig config : configs) {
            persisted.add(PersistedSyncConfig.from(config));
        }
        return mapper.writeValueAsBytes(persisted);
    }

    /**
     * @throws IOException if {@code data} is not a JSON array of configs, or a config is invalid
     */
    public List<SyncConfig> decode(byte[] data) throws IOException {
        List<PersistedSyncConfig> persisted = mapper.readValue(data, LIST_TYPE);
        if (persisted == null) {
            throw new IOException("Config payload is not an array.");
        }
        List<SyncConfig> configs = new ArrayList<>(persisted.size());
        for (int i = 0; i < persisted.size(); i++) {
            PersistedSyncConfig entry = persisted.get(i);
            if (entry == null) {
                throw new IOException("Config payload has a null entry at index " + i);
            }
            try {
                configs.add(entry.toConfig());
            } catch (IllegalArgumentException | NullPointerException ex) {
                throw new IOException("Invalid config at index " + i, ex);
            }
        }
        return configs;
    }
}
