package com.example.syncreconciler.assign;

import com.example.syncreconciler.tree.Fingerprint;
import com.example.syncreconciler.tree.NodeType;
import com.example.syncreconciler.tree.TrackedEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-map from (type, size, mtime) to the tracked entries carrying that fingerprint.
 *
 * <p>Content hashes are checked on lookup rather than keyed on, so an entry recorded
 * without a hash still matches a hashed live fingerprint.
 */
public final class FingerprintIndex {
    private final Map<Key, List<TrackedEntry>> entries = new HashMap<>();
    private int size;

    public void add(TrackedEntry entry) {
        Fingerprint fingerprint = entry.fingerprint()
                .orElseThrow(() -> new IllegalArgumentException("Entry " + entry + " has no fingerprint."));
        entries.computeIfAbsent(Key.of(entry.type(), fingerprint), ignored -> new ArrayList<>()).add(entry);
        size++;
    }

    /**
     * Entries of {@code type} whose fingerprint matches {@code live}, in insertion order.
     */
    public List<TrackedEntry> candidates(NodeType type, Fingerprint live) {
        List<TrackedEntry> bucket = entries.get(Key.of(type, live));
        if (bucket == null) {
            return List.of();
        }
        List<TrackedEntry> result = new ArrayList<>(bucket.size());
        for (TrackedEntry entry : bucket) {
            if (entry.fingerprint().map(live::matches).orElse(false)) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * All entries filed under {@code key}, hashes unchecked.
     */
    List<TrackedEntry> bucket(Key key) {
        List<TrackedEntry> bucket = entries.get(key);
        return bucket == null ? List.of() : Collections.unmodifiableList(bucket);
    }

    public boolean remove(TrackedEntry entry) {
        if (entry.fingerprint().isEmpty()) {
            return false;
        }
        Key key = Key.of(entry.type(), entry.fingerprint().get());
        List<TrackedEntry> bucket = entries.get(key);
        if (bucket == null || !bucket.remove(entry)) {
            return false;
        }
        if (bucket.isEmpty()) {
            entries.remove(key);
        }
        size--;
        return true;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    record Key(NodeType type, long size, long modificationTime) {
        static Key of(NodeType type, Fingerprint fingerprint) {
            return new Key(type, fingerprint.size(), fingerprint.modificationTime());
        }
    }
}
