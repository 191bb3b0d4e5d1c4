package com.example.syncreconciler.config;

import com.example.syncreconciler.config.RecordingObserver.Event;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigStoreTest {
    private static final String DB_PATH = "/drive/.megaclient";
    private static final String DRIVE = "/drive";

    private final RecordingObserver observer = new RecordingObserver();
    private final ConfigStore store = new ConfigStore(DB_PATH, DRIVE, observer);
    private final ScriptedIOContext io = new ScriptedIOContext();

    @Test
    void addingANewConfigNotifiesAddThenDirty() {
        SyncConfig config = config(1, 2);

        assertEquals(config, store.add(config));

        assertEquals(List.of(Event.add(config), Event.dirty()), observer.events());
        assertTrue(store.dirty());
        assertEquals(Optional.of(config), store.get(1));
        assertEquals(Optional.of(config), store.getByRemoteRoot(RemoteHandle.of(2)));
        assertEquals(DB_PATH, store.dbPath());
        assertEquals(DRIVE, store.drivePath());
    }

    @Test
    void reAddingAnIdenticalConfigIsSilent() {
        SyncConfig config = config(1, 2);
        store.add(config);
        observer.reset();

        store.add(SyncConfig.of(1, "/drive/sync-1", RemoteHandle.of(2)));

        assertTrue(observer.events().isEmpty());
    }

    @Test
    void updatingAConfigNotifiesChangeThenDirty() {
        SyncConfig before = config(1, 2);
        SyncConfig after = before.withEnabled(false);
        store.add(before);
        observer.reset();

        store.add(after);

        assertEquals(List.of(Event.change(before, after), Event.dirty()), observer.events());
        assertEquals(Optional.of(after), store.get(1));
    }

    @Test
    void undefinedRemoteRootIsNeverIndexed() {
        store.add(config(1, RemoteHandle.UNDEF.value()));

        assertTrue(store.getByRemoteRoot(RemoteHandle.UNDEF).isEmpty());
        assertEquals(ConfigResult.NOT_FOUND, store.removeByRemoteRoot(RemoteHandle.UNDEF));
        assertEquals(1, store.configs().size());
    }

    @Test
    void changingTheRemoteRootRepointsTheIndex() {
        SyncConfig before = config(1, 2);
        store.add(before);

        store.add(before.withRemoteRoot(RemoteHandle.of(3)));

        assertTrue(store.getByRemoteRoot(RemoteHandle.of(2)).isEmpty());
        assertEquals(1, store.getByRemoteRoot(RemoteHandle.of(3)).orElseThrow().backupId());

        store.add(before.withRemoteRoot(RemoteHandle.UNDEF));

        assertTrue(store.getByRemoteRoot(RemoteHandle.of(3)).isEmpty());
    }

    @Test
    void removesByBackupId() {
        SyncConfig config = config(1, 2);
        store.add(config);
        observer.reset();

        assertEquals(ConfigResult.OK, store.remove(1));

        assertEquals(List.of(Event.remove(config), Event.dirty()), observer.events());
        assertTrue(store.configs().isEmpty());
        assertTrue(store.getByRemoteRoot(RemoteHandle.of(2)).isEmpty());
    }

    @Test
    void removesByRemoteRoot() {
        SyncConfig config = config(1, 2);
        store.add(config);
        observer.reset();

        assertEquals(ConfigResult.OK, store.removeByRemoteRoot(RemoteHandle.of(2)));

        assertEquals(List.of(Event.remove(config), Event.dirty()), observer.events());
        assertTrue(store.configs().isEmpty());
        assertTrue(store.get(1).isEmpty());
        assertTrue(store.getByRemoteRoot(RemoteHandle.of(2)).isEmpty());
    }

    @Test
    void removingUnknownConfigsReportsNotFound() {
        assertEquals(ConfigResult.NOT_FOUND, store.remove(1));
        assertEquals(ConfigResult.NOT_FOUND, store.removeByRemoteRoot(RemoteHandle.of(2)));

        store.add(config(1, 2));
        observer.reset();

        assertEquals(ConfigResult.NOT_FOUND, store.remove(7));
        assertEquals(ConfigResult.NOT_FOUND, store.removeByRemoteRoot(RemoteHandle.of(7)));
        assertTrue(observer.events().isEmpty());
    }

    @Test
    void clearRemovesInInsertionOrderThenDirtiesOnce() {
        SyncConfig b = config(2, 20);
        SyncConfig a = config(1, 10);
        store.add(b);
        store.add(a);
        observer.reset();

        store.clear();

        assertEquals(List.of(Event.remove(b), Event.remove(a), Event.dirty()), observer.events());
        assertTrue(store.configs().isEmpty());
    }

    @Test
    void clearingAnEmptyStoreIsSilent() {
        store.clear();

        assertTrue(observer.events().isEmpty());
        assertFalse(store.dirty());
    }

    @Test
    void closeRemovesWithoutDirtying() {
        SyncConfig config = config(1, 2);
        store.add(config);
        observer.reset();

        store.close();

        assertEquals(List.of(Event.remove(config)), observer.events());
    }

    @Test
    void writesAJsonArrayAndRotatesSlots() {
        store.add(config(1, 2));

        assertEquals(ConfigResult.OK, store.write(io));
        assertFalse(store.dirty());
        assertEquals(ConfigResult.OK, store.write(io));
        assertEquals(ConfigResult.OK, store.write(io));

        List<ScriptedIOContext.Write> writes = io.writes();
        assertEquals(List.of(0, 1, 0), writes.stream().map(ScriptedIOContext.Write::slot).toList());
        assertEquals(DB_PATH, writes.get(0).storePath());
        assertTrue(writes.get(0).json().startsWith("[{"));
    }

    @Test
    void emptyStoreWritesAnEmptyArray() {
        assertEquals(ConfigResult.OK, store.write(io));

        assertEquals("[]", io.writes().get(0).json());
    }

    @Test
    void failedWriteKeepsSlotAndDirtyFlag() {
        store.add(config(1, 2));
        io.failWrites(true);

        assertEquals(ConfigResult.WRITE_ERROR, store.write(io));

        assertTrue(store.dirty());
        assertEquals(0, store.slot());

        io.failWrites(false);
        assertEquals(ConfigResult.OK, store.write(io));
        assertEquals(0, io.writes().get(0).slot());
    }

    @Test
    void readsBackWhatWasWrittenWithoutDirtying() {
        SyncConfig config = config(1, 2);
        store.add(config);
        store.write(io);
        store.clear();
        observer.reset();
        io.slots(0);

        assertEquals(ConfigResult.OK, store.read(io));

        assertEquals(List.of(Event.add(config)), observer.events());
        assertFalse(store.dirty());
        assertEquals(Optional.of(config), store.get(1));
        assertEquals(Optional.of(config), store.getByRemoteRoot(RemoteHandle.of(2)));
        assertEquals(1, store.slot());
    }

    @Test
    void readingAnEmptySlotRemovesExistingConfigs() {
        SyncConfig config = config(1, 2);
        store.add(config);
        observer.reset();
        io.slots(0).content(0, "[]");

        assertEquals(ConfigResult.OK, store.read(io));

        assertEquals(List.of(Event.remove(config)), observer.events());
        assertTrue(store.get(1).isEmpty());
        assertTrue(store.getByRemoteRoot(RemoteHandle.of(2)).isEmpty());
    }

    @Test
    void readingReplacesChangedConfigs() {
        SyncConfig before = config(1, 2);
        store.add(before);
        store.write(io);
        SyncConfig after = before.withRemoteRoot(RemoteHandle.of(3));
        store.add(after);
        observer.reset();
        io.slots(0);

        assertEquals(ConfigResult.OK, store.read(io));

        assertEquals(List.of(Event.change(after, before)), observer.events());
        assertEquals(Optional.of(before), store.getByRemoteRoot(RemoteHandle.of(2)));
        assertTrue(store.getByRemoteRoot(RemoteHandle.of(3)).isEmpty());
        assertFalse(store.dirty());
    }

    @Test
    void readTriesEverySlotNewestFirst() {
        io.slots(1, 2, 3).content(3, "[]").content(2, "not json");

        assertEquals(ConfigResult.OK, store.read(io));

        assertEquals(List.of(1, 2, 3), io.reads());
    }

    @Test
    void readFailsWhenNoSlotIsReadable() {
        io.slots(1);

        assertEquals(ConfigResult.READ_ERROR, store.read(io));
    }

    @Test
    void readReportsNotFoundWithoutSlots() {
        assertEquals(ConfigResult.NOT_FOUND, store.read(io));
        assertEquals(ConfigResult.NOT_FOUND, store.read(new ScriptedIOContext().missingDirectory()));
        assertTrue(observer.events().isEmpty());
    }

    @Test
    void requiresAtLeastTwoSlots() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConfigStore(DB_PATH, DRIVE, observer, new SyncConfigCodec(), 1));
    }

    private static SyncConfig config(long backupId, long remoteRoot) {
        return SyncConfig.of(backupId, "/drive/sync-" + backupId, RemoteHandle.of(remoteRoot));
    }
}
