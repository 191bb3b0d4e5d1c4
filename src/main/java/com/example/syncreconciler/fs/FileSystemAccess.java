package com.example.syncreconciler.fs;

import java.io.IOException;

/**
 * Host filesystem capability consumed by identity assignment and slot persistence.
 *
 * <p>Every fallible operation reports failure through {@link IOException}; none of them
 * return partially opened handles.
 */
public interface FileSystemAccess {
    /**
     * Opens an existing file or folder for metadata and content reads.
     */
    FileHandle openFile(String path) throws IOException;

    /**
     * Creates (or truncates) a regular file for writing. The parent folder must exist.
     */
    FileHandle createFile(String path) throws IOException;

    /**
     * Stamps the modification time of an existing object. Hosts may round to their own
     * timestamp resolution.
     */
    void setModificationTime(String path, long epochNanos) throws IOException;

    DirectoryHandle openDirectory(String path) throws IOException;

    char separator();

    /**
     * Whether handles describe the target of a symbolic link rather than the link itself.
     */
    boolean followsLinks();

    default String join(String parent, String name) {
        if (parent.isEmpty()) {
            return name;
        }
        if (parent.charAt(parent.length() - 1) == separator()) {
            return parent + name;
        }
        return parent + separator() + name;
    }
}
