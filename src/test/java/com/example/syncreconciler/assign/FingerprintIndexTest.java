package com.example.syncreconciler.assign;

import com.example.syncreconciler.tree.Fingerprint;
import com.example.syncreconciler.tree.NodeType;
import com.example.syncreconciler.tree.TrackedEntry;
import com.example.syncreconciler.tree.TrackedTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FingerprintIndexTest {
    private final TrackedTree tree = new TrackedTree("root");

    @Test
    void returnsEntriesOfTheSameTypeAndFingerprint() {
        TrackedEntry a = tree.entry(tree.addFile(tree.root().key(), "a", new Fingerprint(10, 5, "h1")));
        TrackedEntry b = tree.entry(tree.addFile(tree.root().key(), "b", new Fingerprint(10, 5, "h1")));
        TrackedEntry folder = tree.entry(tree.addFolder(tree.root().key(), "c", Fingerprint.of(10, 5)));
        FingerprintIndex index = new FingerprintIndex();
        index.add(a);
        index.add(b);
        index.add(folder);

        assertEquals(List.of(a, b), index.candidates(NodeType.FILE, new Fingerprint(10, 5, "h1")));
        assertEquals(List.of(folder), index.candidates(NodeType.FOLDER, Fingerprint.of(10, 5)));
        assertEquals(3, index.size());
    }

    @Test
    void hashesAreComparedOnlyWhenBothSidesHaveOne() {
        TrackedEntry hashed = tree.entry(tree.addFile(tree.root().key(), "a", new Fingerprint(10, 5, "h1")));
        TrackedEntry plain = tree.entry(tree.addFile(tree.root().key(), "b", Fingerprint.of(10, 5)));
        FingerprintIndex index = new FingerprintIndex();
        index.add(hashed);
        index.add(plain);

        assertEquals(List.of(plain), index.candidates(NodeType.FILE, new Fingerprint(10, 5, "h2")));
        assertEquals(List.of(hashed, plain), index.candidates(NodeType.FILE, Fingerprint.of(10, 5)));
        assertTrue(index.candidates(NodeType.FILE, Fingerprint.of(10, 6)).isEmpty());
    }

    @Test
    void removedEntriesAreNoLongerCandidates() {
        TrackedEntry a = tree.entry(tree.addFile(tree.root().key(), "a", Fingerprint.of(1, 1)));
        FingerprintIndex index = new FingerprintIndex();
        index.add(a);

        assertTrue(index.remove(a));
        assertFalse(index.remove(a));
        assertTrue(index.isEmpty());
        assertTrue(index.candidates(NodeType.FILE, Fingerprint.of(1, 1)).isEmpty());
    }

    @Test
    void rejectsEntriesWithoutFingerprint() {
        TrackedEntry a = tree.entry(tree.addFolder(tree.root().key(), "a", null));

        assertThrows(IllegalArgumentException.class, () -> new FingerprintIndex().add(a));
    }
}
