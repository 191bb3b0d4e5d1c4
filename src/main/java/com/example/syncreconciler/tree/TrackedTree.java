package com.example.syncreconciler.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Arena of tracked entries for one sync, addressed by stable numeric keys.
 *
 * <p>Parent/child links and the filesystem-id reverse index are key-to-key mappings. An entry
 * appears in the reverse index exactly when its filesystem id is set, and removing an entry
 * from the tree removes its subtree from the reverse index as well.
 *
 * <p>Not thread-safe: one tree belongs to one sync and is mutated by one thread at a time.
 */
public final class TrackedTree {
    public static final long NO_PARENT = -1L;

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackedTree.class);

    private final Map<Long, TrackedEntry> entries = new LinkedHashMap<>();
    private final FsidIndex fsidIndex = new FsidIndex();
    private final char separator;
    private final long rootKey;
    private long nextKey;

    public TrackedTree(String rootPath) {
        this(rootPath, '/');
    }

    /**
     * Creates a tree whose root folder entry is named after the sync's local root path.
     */
    public TrackedTree(String rootPath, char separator) {
        Objects.requireNonNull(rootPath, "rootPath");
        if (rootPath.isEmpty()) {
            throw new IllegalArgumentException("Root path must not be empty.");
        }
        this.separator = separator;
        this.rootKey = allocate(NodeType.FOLDER, rootPath, NO_PARENT, null).key();
    }

    public char separator() {
        return separator;
    }

    public TrackedEntry root() {
        return entry(rootKey);
    }

    public TrackedEntry entry(long key) {
        TrackedEntry entry = entries.get(key);
        if (entry == null) {
            throw new NoSuchElementException("No tracked entry with key " + key);
        }
        return entry;
    }

    public Optional<TrackedEntry> find(long key) {
        return Optional.ofNullable(entries.get(key));
    }

    public long addFolder(long parentKey, String name, Fingerprint fingerprint) {
        return add(parentKey, NodeType.FOLDER, name, fingerprint);
    }

    public long addFile(long parentKey, String name, Fingerprint fingerprint) {
        return add(parentKey, NodeType.FILE, name, fingerprint);
    }

    private long add(long parentKey, NodeType type, String name, Fingerprint fingerprint) {
        TrackedEntry parent = entry(parentKey);
        if (parent.type() != NodeType.FOLDER) {
            throw new IllegalArgumentException("Parent " + parent + " is not a folder.");
        }
        if (name == null || name.isEmpty() || name.indexOf(separator) >= 0) {
            throw new IllegalArgumentException("Invalid entry name: " + name);
        }
        TrackedEntry child = allocate(type, name, parentKey, fingerprint);
        parent.addChild(child.key());
        return child.key();
    }

    private TrackedEntry allocate(NodeType type, String name, long parentKey, Fingerprint fingerprint) {
        TrackedEntry entry = new TrackedEntry(nextKey++, type, name, parentKey, fingerprint);
        entries.put(entry.key(), entry);
        return entry;
    }

    /**
     * Removes the entry and its whole subtree from tracking, dropping their reverse-index entries.
     */
    public void remove(long key) {
        TrackedEntry entry = entry(key);
        if (entry.isRoot()) {
            throw new IllegalArgumentException("The root entry cannot be removed.");
        }
        for (TrackedEntry doomed : subtree(key)) {
            clearFsid(doomed.key());
            entries.remove(doomed.key());
        }
        entry(entry.parentKey()).removeChild(key);
    }

    public List<TrackedEntry> children(long key) {
        List<TrackedEntry> result = new ArrayList<>();
        for (Long childKey : entry(key).childKeys()) {
            result.add(entries.get(childKey));
        }
        return result;
    }

    public Optional<TrackedEntry> parent(long key) {
        TrackedEntry entry = entry(key);
        return entry.isRoot() ? Optional.empty() : Optional.of(entry(entry.parentKey()));
    }

    /**
     * Returns every entry below {@code key} in depth-first declaration order, excluding {@code key}.
     */
    public List<TrackedEntry> descendants(long key) {
        List<TrackedEntry> result = subtree(key);
        result.remove(0);
        return result;
    }

    private List<TrackedEntry> subtree(long key) {
        List<TrackedEntry> result = new ArrayList<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(key);
        while (!pending.isEmpty()) {
            TrackedEntry current = entry(pending.pop());
            result.add(current);
            List<Long> childKeys = current.childKeys();
            for (int i = childKeys.size() - 1; i >= 0; i--) {
                pending.push(childKeys.get(i));
            }
        }
        return result;
    }

    /**
     * Path the entry was last recorded at: the root path followed by the entry names.
     */
    public String path(long key) {
        Deque<String> names = new ArrayDeque<>();
        TrackedEntry current = entry(key);
        names.push(current.name());
        while (!current.isRoot()) {
            current = entry(current.parentKey());
            names.push(current.name());
        }
        return String.join(String.valueOf(separator), names);
    }

    public void setFingerprint(long key, Fingerprint fingerprint) {
        entry(key).setFingerprint(fingerprint);
    }

    /**
     * Associates {@code fsid} with the entry. If another entry held the same id it loses it.
     */
    public void setFsid(long key, FsId fsid) {
        Objects.requireNonNull(fsid, "fsid");
        TrackedEntry entry = entry(key);
        if (fsid.equals(entry.fsid().orElse(null))) {
            return;
        }
        clearFsid(key);
        fsidIndex.put(fsid, key).ifPresent(previousKey -> {
            LOGGER.debug("Filesystem id {} moved from entry {} to {}", fsid, previousKey, key);
            entry(previousKey).setFsid(null);
        });
        entry.setFsid(fsid);
    }

    public void clearFsid(long key) {
        TrackedEntry entry = entry(key);
        entry.fsid().ifPresent(fsid -> fsidIndex.remove(fsid, key));
        entry.setFsid(null);
    }

    public Optional<TrackedEntry> findByFsid(FsId fsid) {
        return fsidIndex.keyFor(fsid).map(this::entry);
    }

    public int reverseIndexSize() {
        return fsidIndex.size();
    }

    public Map<FsId, Long> reverseIndexSnapshot() {
        return fsidIndex.snapshot();
    }

    public int size() {
        return entries.size();
    }
}
