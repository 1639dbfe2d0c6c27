package com.example.mediastore_backend.exception;

/** Unsupported endpoint or missing credentials. Never retried automatically. */
public class StorageConfigurationException extends StorageException {

    public StorageConfigurationException(String message) {
        super(StorageErrorKind.CONFIGURATION, message, null);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(StorageErrorKind.CONFIGURATION, message, cause);
    }
}
