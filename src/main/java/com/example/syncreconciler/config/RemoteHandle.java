package com.example.syncreconciler.config;

/**
 * Identifier of the remote folder a sync is rooted at.
 */
public record RemoteHandle(long value) {
    public static final RemoteHandle UNDEF = new RemoteHandle(-1L);

    public static RemoteHandle of(long value) {
        return value == UNDEF.value ? UNDEF : new RemoteHandle(value);
    }

    public boolean isUndef() {
        return value == UNDEF.value;
    }

    @Override
    public String toString() {
        return isUndef() ? "UNDEF" : Long.toHexString(value);
    }
}
