package com.example.syncreconciler.tree;

import java.util.Objects;

/**
 * Opaque filesystem identifier reported by the platform for a live object.
 */
public record FsId(String value) implements Comparable<FsId> {
    public FsId {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Filesystem id must not be empty.");
        }
    }

    public static FsId of(long value) {
        return new FsId(Long.toString(value));
    }

    @Override
    public int compareTo(FsId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
