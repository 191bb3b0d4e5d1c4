package com.example.syncreconciler.tree;

import java.util.Objects;

/**
 * Cheap content identity: size and modification time, optionally a content hash.
 *
 * <p>{@code contentHash} is {@code null} when the content was not (or could not be) sampled.
 */
public record Fingerprint(long size, long modificationTime, String contentHash) {

    public static Fingerprint of(long size, long modificationTime) {
        return new Fingerprint(size, modificationTime, null);
    }

    public boolean hasContentHash() {
        return contentHash != null;
    }

    /**
     * Size and mtime must agree; hashes are only compared when both sides carry one.
     */
    public boolean matches(Fingerprint other) {
        if (other == null || size != other.size || modificationTime != other.modificationTime) {
            return false;
        }
        if (contentHash == null || other.contentHash == null) {
            return true;
        }
        return Objects.equals(contentHash, other.contentHash);
    }
}
