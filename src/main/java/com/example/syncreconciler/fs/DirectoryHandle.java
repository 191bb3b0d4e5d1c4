package com.example.syncreconciler.fs;

import java.io.IOException;
import java.util.Optional;

/**
 * An open folder listing. Yields child names (not paths) until exhausted.
 */
public interface DirectoryHandle extends AutoCloseable {
    Optional<String> next() throws IOException;

    @Override
    void close() throws IOException;
}
