package com.example.syncreconciler.config;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Encrypt-then-MAC cipher for config store slots.
 *
 * <p>Blob layout: {@code IV(16) | AES-CBC ciphertext | HMAC-SHA256(IV | ciphertext)}.
 * The AES and HMAC keys are both derived from the caller's key material.
 */
public final class AesHmacConfigCipher implements ConfigCipher {
    static final int IV_LENGTH = 16;
    static final int BLOCK_LENGTH = 16;
    static final int MAC_LENGTH = 32;

    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final String CIPHER_ALGORITHM = "AES/CBC/PKCS5Padding";

    private final SecretKeySpec encryptionKey;
    private final SecretKeySpec macKey;
    private final SecureRandom random;

    public AesHmacConfigCipher(byte[] keyMaterial) {
        this(keyMaterial, new SecureRandom());
    }

    AesHmacConfigCipher(byte[] keyMaterial, SecureRandom random) {
        if (keyMaterial == null || keyMaterial.length == 0) {
            throw new IllegalArgumentException("Key material must not be empty.");
        }
        this.encryptionKey = new SecretKeySpec(derive(keyMaterial, "enc"), 0, 16, "AES");
        this.macKey = new SecretKeySpec(derive(keyMaterial, "mac"), MAC_ALGORITHM);
        this.random = random;
    }

    @Override
    public byte[] encrypt(byte[] plaintext) throws ConfigCipherException {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
            byte[] body = cipher.doFinal(plaintext);
            byte[] blob = new byte[IV_LENGTH + body.length + MAC_LENGTH];
            System.arraycopy(iv, 0, blob, 0, IV_LENGTH);
            System.arraycopy(body, 0, blob, IV_LENGTH, body.length);
            byte[] tag = mac(blob, IV_LENGTH + body.length);
            System.arraycopy(tag, 0, blob, IV_LENGTH + body.length, MAC_LENGTH);
            return blob;
        } catch (GeneralSecurityException ex) {
            throw new ConfigCipherException("Unable to encrypt config payload", ex);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) throws ConfigCipherException {
        if (ciphertext == null || ciphertext.length < IV_LENGTH + BLOCK_LENGTH + MAC_LENGTH) {
            throw new ConfigCipherException("Config payload too short.");
        }
        int macOffset = ciphertext.length - MAC_LENGTH;
        byte[] expected = mac(ciphertext, macOffset);
        byte[] actual = Arrays.copyOfRange(ciphertext, macOffset, ciphertext.length);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new ConfigCipherException("Config payload failed authentication.");
        }
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new IvParameterSpec(ciphertext, 0, IV_LENGTH));
            return cipher.doFinal(ciphertext, IV_LENGTH, macOffset - IV_LENGTH);
        } catch (GeneralSecurityException ex) {
            throw new ConfigCipherException("Unable to decrypt config payload", ex);
        }
    }

    private byte[] mac(byte[] data, int length) throws ConfigCipherException {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(macKey);
            mac.update(data, 0, length);
            return mac.doFinal();
        } catch (GeneralSecurityException ex) {
            throw new ConfigCipherException("Unable to authenticate config payload", ex);
        }
    }

    private static byte[] derive(byte[] keyMaterial, String label) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(keyMaterial, MAC_ALGORITHM));
            return mac.doFinal(label.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
