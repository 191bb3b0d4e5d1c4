package com.example.syncreconciler.assign;

import com.example.syncreconciler.fs.FakeFileSystem;
import com.example.syncreconciler.fs.FileHandle;
import com.example.syncreconciler.tree.Fingerprint;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FingerprintGeneratorTest {
    private final FakeFileSystem fs = new FakeFileSystem();

    @Test
    void hashesSmallFilesWhole() throws Exception {
        fs.folder("r");
        fs.file("r/a", "alpha").modificationTime(42);
        fs.file("r/b", "alphb").modificationTime(42);

        Fingerprint a = generate(new FingerprintGenerator(), "r/a");
        Fingerprint b = generate(new FingerprintGenerator(), "r/b");

        assertEquals(5, a.size());
        assertEquals(42, a.modificationTime());
        assertEquals(64, a.contentHash().length());
        assertFalse(a.matches(b));
    }

    @Test
    void samplesLargeFiles() throws Exception {
        byte[] content = new byte[FingerprintGenerator.FULL_HASH_LIMIT * 4];
        Arrays.fill(content, (byte) 7);
        byte[] changedInSample = content.clone();
        changedInSample[changedInSample.length - 1] = 8;
        byte[] changedBetweenSamples = content.clone();
        changedBetweenSamples[FingerprintGenerator.SAMPLE_SIZE + 10] = 8;
        fs.folder("r");
        fs.file("r/base", content);
        fs.file("r/tail", changedInSample);
        fs.file("r/gap", changedBetweenSamples);

        FingerprintGenerator generator = new FingerprintGenerator();
        Fingerprint base = generate(generator, "r/base");

        assertNotEquals(base.contentHash(), generate(generator, "r/tail").contentHash());
        assertEquals(base.contentHash(), generate(generator, "r/gap").contentHash());
    }

    @Test
    void foldersAndUnhashedFilesCarryNoHash() throws Exception {
        fs.folder("r");
        fs.file("r/a", "alpha");

        assertNull(generate(new FingerprintGenerator(), "r").contentHash());
        assertNull(generate(new FingerprintGenerator(false), "r/a").contentHash());
    }

    @Test
    void readFailureDegradesToSizeAndTime() throws Exception {
        fs.folder("r");
        fs.file("r/a", "alpha").modificationTime(9).unreadable();

        Fingerprint fingerprint = generate(new FingerprintGenerator(), "r/a");

        assertFalse(fingerprint.hasContentHash());
        assertEquals(5, fingerprint.size());
        assertTrue(fingerprint.matches(Fingerprint.of(5, 9)));
    }

    private Fingerprint generate(FingerprintGenerator generator, String path) throws IOException {
        try (FileHandle handle = fs.openFile(path)) {
            return generator.generate(handle);
        }
    }
}
