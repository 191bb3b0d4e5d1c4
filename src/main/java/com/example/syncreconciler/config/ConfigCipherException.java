package com.example.syncreconciler.config;

import java.security.GeneralSecurityException;

public class ConfigCipherException extends GeneralSecurityException {
    public ConfigCipherException(String message) {
        super(message);
    }

    public ConfigCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
