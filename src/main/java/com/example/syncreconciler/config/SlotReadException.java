package com.example.syncreconciler.config;

import java.io.IOException;

/**
 * A slot file exists but its contents could not be authenticated or decrypted.
 */
public class SlotReadException extends IOException {
    private final int slot;

    public SlotReadException(int slot, String message, Throwable cause) {
        super(message, cause);
        this.slot = slot;
    }

    public int slot() {
        return slot;
    }
}
