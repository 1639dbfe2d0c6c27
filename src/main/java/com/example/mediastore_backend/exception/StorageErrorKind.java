package com.example.mediastore_backend.exception;

/**
 * Closed set of failure kinds raised by the storage layer. The kind is assigned once,
 * where the backend operation fails; callers branch on it instead of inspecting messages.
 */
public enum StorageErrorKind {
    CONFIGURATION,
    MALFORMED_PATH,
    CROSS_DEVICE,
    UNSUPPORTED_OPERATION,
    NOT_FOUND,
    ALREADY_EXISTS,
    IO;

    /**
     * @return {@code true} when repeating the same call later may succeed.
     */
    public boolean isRetryable() {
        return this == IO;
    }
}
