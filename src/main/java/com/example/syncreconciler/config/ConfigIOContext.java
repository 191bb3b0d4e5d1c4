package com.example.syncreconciler.config;

import com.example.syncreconciler.fs.DirectoryHandle;
import com.example.syncreconciler.fs.FileHandle;
import com.example.syncreconciler.fs.FileSystemAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Encrypted slot storage for one logical config store.
 *
 * <p>Slot {@code n} of store {@code name} lives in {@code <storePath>/<name>.<n>}. Each write
 * replaces one whole slot file; rotation across slots is the caller's job, so a torn write
 * only ever damages the slot being written.
 */
public class ConfigIOContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigIOContext.class);

    private static final Comparator<SlotFile> NEWEST_FIRST = Comparator.comparingLong(SlotFile::modificationNanos)
            .thenComparingInt(SlotFile::slot)
            .reversed();
    private static final long[] STAMP_STEPS = {1_000_000L, 1_000_000_000L};

    private final ConfigCipher cipher;
    private final FileSystemAccess fileSystem;
    private final String storeName;

    public ConfigIOContext(ConfigCipher cipher, FileSystemAccess fileSystem, String storeName) {
        if (storeName == null || storeName.isEmpty()) {
            throw new IllegalArgumentException("Store name must not be empty.");
        }
        this.cipher = cipher;
        this.fileSystem = fileSystem;
        this.storeName = storeName;
    }

    public String storeName() {
        return storeName;
    }

    /**
     * Slot numbers present under {@code storePath}, newest first: by modification time at the
     * host's full resolution, then by slot number. Files not named {@code <storeName>.<number>}
     * are ignored.
     *
     * @throws IOException if the directory cannot be listed
     */
    public List<Integer> listSlots(String storePath) throws IOException {
        List<SlotFile> slots = scanSlots(storePath);
        slots.sort(NEWEST_FIRST);
        List<Integer> result = new ArrayList<>(slots.size());
        for (SlotFile slot : slots) {
            result.add(slot.slot());
        }
        return result;
    }

    /**
     * Reads and decrypts one slot.
     *
     * @throws SlotReadException if the slot exists but fails authentication or decryption
     * @throws IOException if the slot cannot be read at all
     */
    public byte[] read(String storePath, int slot) throws IOException {
        String path = slotPath(storePath, slot);
        byte[] ciphertext;
        try (FileHandle handle = fileSystem.openFile(path)) {
            long size = handle.stat().size();
            if (size > Integer.MAX_VALUE) {
                throw new IOException("Slot file too large: " + path);
            }
            ciphertext = handle.read(0, (int) size);
        }
        try {
            return cipher.decrypt(ciphertext);
        } catch (ConfigCipherException ex) {
            throw new SlotReadException(slot, "Unable to decrypt slot " + path, ex);
        }
    }

    /**
     * Encrypts {@code data} into the given slot, replacing any previous content of that slot.
     *
     * @throws IOException if the slot file cannot be created or written
     */
    public void write(String storePath, byte[] data, int slot) throws IOException {
        String path = slotPath(storePath, slot);
        byte[] ciphertext;
        try {
            ciphertext = cipher.encrypt(data);
        } catch (ConfigCipherException ex) {
            throw new IOException("Unable to encrypt slot " + path, ex);
        }
        long newestOther = Long.MIN_VALUE;
        for (SlotFile other : scanSlots(storePath)) {
            if (other.slot() != slot) {
                newestOther = Math.max(newestOther, other.modificationNanos());
            }
        }
        try (FileHandle handle = fileSystem.createFile(path)) {
            handle.write(0, ciphertext);
        }
        if (newestOther != Long.MIN_VALUE) {
            stampAfter(path, newestOther);
        }
        LOGGER.debug("Wrote {} bytes to {}", ciphertext.length, path);
    }

    /**
     * Slot rotation wraps around, so the slot just written must list strictly ahead of every
     * other slot. Writes landing within one timestamp tick get pushed forward, first by a
     * millisecond and then by a second for hosts with coarse timestamps.
     */
    private void stampAfter(String path, long newestOther) throws IOException {
        for (long step : STAMP_STEPS) {
            if (modificationNanos(path) > newestOther) {
                return;
            }
            fileSystem.setModificationTime(path, newestOther + step);
        }
        if (modificationNanos(path) <= newestOther) {
            LOGGER.warn("Slot {} could not be stamped newer than the other slots", path);
        }
    }

    private long modificationNanos(String path) throws IOException {
        try (FileHandle handle = fileSystem.openFile(path)) {
            return handle.stat().modificationNanos();
        }
    }

    private List<SlotFile> scanSlots(String storePath) throws IOException {
        List<SlotFile> slots = new ArrayList<>();
        try (DirectoryHandle directory = fileSystem.openDirectory(storePath)) {
            Optional<String> name;
            while ((name = directory.next()).isPresent()) {
                Optional<Integer> slot = parseSlot(name.get());
                if (slot.isEmpty()) {
                    continue;
                }
                String path = fileSystem.join(storePath, name.get());
                try (FileHandle handle = fileSystem.openFile(path)) {
                    slots.add(new SlotFile(slot.get(), handle.stat().modificationNanos()));
                } catch (IOException ex) {
                    LOGGER.warn("Ignoring unreadable slot file {}", path, ex);
                }
            }
        }
        return slots;
    }

    String slotPath(String storePath, int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("Slot must not be negative: " + slot);
        }
        return fileSystem.join(storePath, storeName + "." + slot);
    }

    private Optional<Integer> parseSlot(String fileName) {
        if (!fileName.startsWith(storeName + ".")) {
            return Optional.empty();
        }
        String suffix = fileName.substring(storeName.length() + 1);
        if (suffix.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < suffix.length(); i++) {
            char c = suffix.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(Integer.parseInt(suffix));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private record SlotFile(int slot, long modificationNanos) {
    }
}
