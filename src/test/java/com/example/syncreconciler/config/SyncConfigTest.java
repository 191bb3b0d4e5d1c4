package com.example.syncreconciler.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncConfigTest {
    @Test
    void defaultsToAnEnabledTwoWaySync() {
        SyncConfig config = SyncConfig.of(42, "foo", RemoteHandle.of(123));

        assertTrue(config.enabled());
        assertEquals(SyncType.TWO_WAY, config.type());
        assertTrue(config.isUpSync());
        assertTrue(config.isDownSync());
        assertTrue(config.syncDeletions());
        assertFalse(config.forceOverwrite());
        assertTrue(config.exclusions().isEmpty());
        assertEquals(SyncError.NO_SYNC_ERROR, config.lastError());
        assertFalse(config.isExternal());
    }

    @Test
    void oneWaySyncsChooseTheirOwnFlags() {
        SyncConfig base = SyncConfig.of(42, "foo", RemoteHandle.of(123));

        SyncConfig up = base.withType(SyncType.UP, false, false);
        assertTrue(up.isUpSync());
        assertFalse(up.isDownSync());
        assertFalse(up.syncDeletions());

        SyncConfig down = base.withType(SyncType.DOWN, true, true);
        assertFalse(down.isUpSync());
        assertTrue(down.isDownSync());
        assertTrue(down.forceOverwrite());
    }

    @Test
    void twoWaySyncsMustPropagateDeletionsWithoutForcing() {
        SyncConfig base = SyncConfig.of(42, "foo", RemoteHandle.of(123));

        assertThrows(IllegalArgumentException.class, () -> base.withType(SyncType.TWO_WAY, false, false));
        assertThrows(IllegalArgumentException.class, () -> base.withType(SyncType.TWO_WAY, true, true));
    }

    @Test
    void requiresALocalPath() {
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.of(1, "", RemoteHandle.UNDEF));
        assertThrows(NullPointerException.class, () -> SyncConfig.of(1, null, RemoteHandle.UNDEF));
    }

    @Test
    void copiesExclusionsDefensively() {
        List<String> patterns = new java.util.ArrayList<>(List.of("*.tmp"));
        SyncConfig config = SyncConfig.of(1, "foo", RemoteHandle.UNDEF).withExclusions(patterns);
        patterns.add("*.bak");

        assertEquals(List.of("*.tmp"), config.exclusions());
    }

    @Test
    void mapsPersistedCodes() {
        assertEquals(SyncType.DOWN, SyncType.fromCode(2));
        assertThrows(IllegalArgumentException.class, () -> SyncType.fromCode(9));
        assertEquals(SyncError.LOCAL_FINGERPRINT_MISMATCH, SyncError.fromCode(7));
        assertEquals(SyncError.UNKNOWN_ERROR, SyncError.fromCode(4711));
        assertTrue(RemoteHandle.of(-1).isUndef());
        assertEquals(RemoteHandle.UNDEF, RemoteHandle.of(-1));
    }
}
