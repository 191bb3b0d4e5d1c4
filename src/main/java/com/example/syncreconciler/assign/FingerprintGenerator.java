package com.example.syncreconciler.assign;

import com.example.syncreconciler.fs.FileHandle;
import com.example.syncreconciler.fs.FileStat;
import com.example.syncreconciler.tree.Fingerprint;
import com.example.syncreconciler.tree.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes the fingerprint of an open filesystem object.
 *
 * <p>Small files are hashed whole. Larger files are sampled at {@value #SAMPLE_COUNT}
 * evenly spaced blocks, with the size mixed into the digest, so fingerprinting stays cheap
 * on large trees.
 */
public class FingerprintGenerator {
    static final int FULL_HASH_LIMIT = 64 * 1024;
    static final int SAMPLE_SIZE = 16 * 1024;
    static final int SAMPLE_COUNT = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(FingerprintGenerator.class);

    private final boolean hashContent;

    public FingerprintGenerator() {
        this(true);
    }

    public FingerprintGenerator(boolean hashContent) {
        this.hashContent = hashContent;
    }

    /**
     * Folders and unhashed files get size and mtime only. A read failure while sampling
     * content degrades to the same, it does not fail the fingerprint.
     */
    public Fingerprint generate(FileHandle handle) throws IOException {
        FileStat stat = handle.stat();
        if (!hashContent || handle.type() != NodeType.FILE) {
            return Fingerprint.of(stat.size(), stat.modificationTime());
        }
        try {
            return new Fingerprint(stat.size(), stat.modificationTime(), computeSha256(handle, stat.size()));
        } catch (IOException ex) {
            LOGGER.warn("Failed to sample content of {}", handle.path(), ex);
            return Fingerprint.of(stat.size(), stat.modificationTime());
        }
    }

    private String computeSha256(FileHandle handle, long size) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        if (size <= FULL_HASH_LIMIT) {
            digest.update(handle.read(0, (int) size));
        } else {
            digest.update(ByteBuffer.allocate(Long.BYTES).putLong(size).array());
            long stride = (size - SAMPLE_SIZE) / (SAMPLE_COUNT - 1);
            for (int i = 0; i < SAMPLE_COUNT; i++) {
                digest.update(handle.read(i * stride, SAMPLE_SIZE));
            }
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
