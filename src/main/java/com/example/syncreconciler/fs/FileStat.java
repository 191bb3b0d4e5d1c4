package com.example.syncreconciler.fs;

/**
 * Size and modification time of an opened filesystem object. {@code modificationTime} is in
 * epoch seconds; {@code modificationNanos} carries whatever finer resolution the host offers.
 */
public record FileStat(long size, long modificationTime, long modificationNanos) {
}
