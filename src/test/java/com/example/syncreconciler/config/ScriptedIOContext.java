package com.example.syncreconciler.config;

import com.example.syncreconciler.fs.FakeFileSystem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ConfigIOContext} whose slots live in memory, unencrypted. Slots without content fail to read.
 */
final class ScriptedIOContext extends ConfigIOContext {
    record Write(String storePath, String json, int slot) {
    }

    private final Map<Integer, byte[]> contents = new HashMap<>();
    private final List<Integer> reads = new ArrayList<>();
    private final List<Write> writes = new ArrayList<>();
    private List<Integer> slots = List.of();
    private boolean missingDirectory;
    private boolean failWrites;

    ScriptedIOContext() {
        super(new AesHmacConfigCipher(new byte[]{1, 2, 3}), new FakeFileSystem(), "scripted");
    }

    ScriptedIOContext slots(Integer... order) {
        slots = List.of(order);
        return this;
    }

    ScriptedIOContext content(int slot, String json) {
        contents.put(slot, json.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    ScriptedIOContext missingDirectory() {
        missingDirectory = true;
        return this;
    }

    void failWrites(boolean value) {
        failWrites = value;
    }

    List<Integer> reads() {
        return List.copyOf(reads);
    }

    List<Write> writes() {
        return List.copyOf(writes);
    }

    @Override
    public List<Integer> listSlots(String storePath) throws IOException {
        if (missingDirectory) {
            throw new NoSuchFileException(storePath);
        }
        return slots;
    }

    @Override
    public byte[] read(String storePath, int slot) throws IOException {
        reads.add(slot);
        byte[] data = contents.get(slot);
        if (data == null) {
            throw new SlotReadException(slot, "Scripted read failure", null);
        }
        return data.clone();
    }

    @Override
    public void write(String storePath, byte[] data, int slot) throws IOException {
        if (failWrites) {
            throw new IOException("Scripted write failure");
        }
        writes.add(new Write(storePath, new String(data, StandardCharsets.UTF_8), slot));
        contents.put(slot, data.clone());
    }
}
