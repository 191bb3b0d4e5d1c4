package com.example.syncreconciler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerSettingsLoaderTest {
    @TempDir
    Path tempDir;

    private final ReconcilerSettingsLoader loader = new ReconcilerSettingsLoader();

    @Test
    void loadsEveryField() throws Exception {
        Path file = Path.of(getClass().getResource("/reconciler-settings.json").toURI());

        ReconcilerSettings settings = loader.load(file);

        assertEquals("/var/lib/sync/store", settings.storeDirectory());
        assertEquals("backups", settings.storeName());
        assertEquals(3, settings.maxSlots());
        assertEquals(".rubbish", settings.debrisFolderName());
        assertTrue(settings.followLinks());
        assertFalse(settings.hashContent());
        assertEquals(List.of("Thumbs.db", "desktop.ini", "ehthumbs.db", ".DS_Store", "$RECYCLE.BIN",
                "System Volume Information", "*.tmp", "node_modules"), settings.defaultExclusions());
    }

    @Test
    void appliesDefaults() throws Exception {
        Path file = Files.writeString(tempDir.resolve("settings.json"),
                "{\"storeDirectory\":\"store\",\"maxSlots\":1,\"storeName\":\" \"}");

        ReconcilerSettings settings = loader.load(file);

        assertEquals("syncconfigs", settings.storeName());
        assertEquals(2, settings.maxSlots());
        assertEquals(".debris", settings.debrisFolderName());
        assertFalse(settings.followLinks());
        assertTrue(settings.hashContent());
        assertEquals(6, settings.defaultExclusions().size());
    }

    @Test
    void requiresAStoreDirectory() throws Exception {
        Path file = Files.writeString(tempDir.resolve("settings.json"), "{\"storeName\":\"x\"}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }

    @Test
    void rejectsStoreNamesWithSeparators() throws Exception {
        Path file = Files.writeString(tempDir.resolve("settings.json"),
                "{\"storeDirectory\":\"store\",\"storeName\":\"a/b\"}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }
}
