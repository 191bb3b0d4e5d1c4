package com.example.syncreconciler.fs;

import com.example.syncreconciler.tree.FsId;
import com.example.syncreconciler.tree.NodeType;

import java.io.IOException;
import java.util.Optional;

/**
 * An open file or folder. Handles must be closed on every exit path; callers use
 * try-with-resources.
 */
public interface FileHandle extends AutoCloseable {
    String path();

    NodeType type();

    boolean isSymbolicLink();

    FileStat stat() throws IOException;

    /**
     * Platform identifier of the object, or empty when the platform reports an invalid one.
     */
    Optional<FsId> filesystemId();

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     */
    byte[] read(long offset, int length) throws IOException;

    void write(long offset, byte[] data) throws IOException;

    @Override
    void close() throws IOException;
}
