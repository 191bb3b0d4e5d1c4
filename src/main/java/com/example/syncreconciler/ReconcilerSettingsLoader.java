package com.example.syncreconciler;

import com.example.syncreconciler.config.ConfigStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ReconcilerSettingsLoader {
    private static final String DEFAULT_STORE_NAME = "syncconfigs";
    private static final String DEFAULT_DEBRIS_FOLDER = ".debris";
    private static final List<String> DEFAULT_EXCLUSIONS = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store",
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;

    public ReconcilerSettingsLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ReconcilerSettings load(Path path) throws IOException {
        RawSettings raw = mapper.readValue(path.toFile(), RawSettings.class);

        if (raw.storeDirectory == null || raw.storeDirectory.isBlank()) {
            throw new IllegalArgumentException("Settings must include a storeDirectory.");
        }

        String storeName = optionalString(raw.storeName, DEFAULT_STORE_NAME);
        if (storeName.indexOf('/') >= 0 || storeName.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("storeName must be a plain file name: " + storeName);
        }
        int maxSlots = raw.maxSlots != null && raw.maxSlots >= 2
                ? raw.maxSlots
                : ConfigStore.DEFAULT_MAX_SLOTS;
        String debrisFolderName = optionalString(raw.debrisFolderName, DEFAULT_DEBRIS_FOLDER);
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        boolean hashContent = raw.hashContent == null || raw.hashContent;
        List<String> exclusions = mergePatterns(DEFAULT_EXCLUSIONS, raw.defaultExclusions);

        return new ReconcilerSettings(
                raw.storeDirectory,
                storeName,
                maxSlots,
                debrisFolderName,
                followLinks,
                hashContent,
                exclusions
        );
    }

    static List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawSettings {
        public String storeDirectory;
        public String storeName;
        public Integer maxSlots;
        public String debrisFolderName;
        public Boolean followLinks;
        public Boolean hashContent;
        public List<String> defaultExclusions;
    }
}
