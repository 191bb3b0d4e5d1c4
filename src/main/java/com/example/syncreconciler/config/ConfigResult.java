package com.example.syncreconciler.config;

public enum ConfigResult {
    OK,
    /** Nothing to act on: unknown key, empty store, or no slot ever written. */
    NOT_FOUND,
    READ_ERROR,
    WRITE_ERROR
}
