package com.example.syncreconciler.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One previously known filesystem object held in a {@link TrackedTree}.
 *
 * <p>Entries are created and destroyed only through their tree, which owns the parent/child
 * links and keeps the filesystem-id reverse index consistent.
 */
public final class TrackedEntry {
    private final long key;
    private final NodeType type;
    private final String name;
    private final long parentKey;
    private final List<Long> children = new ArrayList<>();
    private Fingerprint fingerprint;
    private FsId fsid;

    TrackedEntry(long key, NodeType type, String name, long parentKey, Fingerprint fingerprint) {
        this.key = key;
        this.type = type;
        this.name = name;
        this.parentKey = parentKey;
        this.fingerprint = fingerprint;
    }

    public long key() {
        return key;
    }

    public NodeType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public long parentKey() {
        return parentKey;
    }

    public boolean isRoot() {
        return parentKey == TrackedTree.NO_PARENT;
    }

    public Optional<Fingerprint> fingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    public Optional<FsId> fsid() {
        return Optional.ofNullable(fsid);
    }

    public List<Long> childKeys() {
        return Collections.unmodifiableList(children);
    }

    void setFingerprint(Fingerprint fingerprint) {
        this.fingerprint = fingerprint;
    }

    void setFsid(FsId fsid) {
        this.fsid = fsid;
    }

    void addChild(long childKey) {
        children.add(childKey);
    }

    void removeChild(long childKey) {
        children.remove(Long.valueOf(childKey));
    }

    @Override
    public String toString() {
        return type + ":" + name + "#" + key;
    }
}
