package com.example.syncreconciler.config;

/**
 * Authenticated encryption of whole store payloads.
 */
public interface ConfigCipher {
    byte[] encrypt(byte[] plaintext) throws ConfigCipherException;

    /**
     * @throws ConfigCipherException if {@code ciphertext} is malformed or fails authentication
     */
    byte[] decrypt(byte[] ciphertext) throws ConfigCipherException;
}
