package com.example.syncreconciler.tree;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reverse index from filesystem identifier to the key of the tracked entry holding it.
 */
final class FsidIndex {
    private final Map<FsId, Long> keys = new HashMap<>();

    /**
     * Records {@code fsid} for {@code key}, returning the key that previously held it, if any.
     */
    Optional<Long> put(FsId fsid, long key) {
        return Optional.ofNullable(keys.put(fsid, key));
    }

    boolean remove(FsId fsid, long key) {
        return keys.remove(fsid, key);
    }

    Optional<Long> keyFor(FsId fsid) {
        return Optional.ofNullable(keys.get(fsid));
    }

    int size() {
        return keys.size();
    }

    /**
     * Returns a copy of the current mapping for diagnostics or tests.
     */
    Map<FsId, Long> snapshot() {
        return Map.copyOf(keys);
    }
}
