package com.example.mediastore_backend.exception;

/**
 * Base failure of a storage operation. Used directly for transient I/O faults
 * (network, disk); the subclasses cover the other {@link StorageErrorKind}s.
 */
public class StorageException extends RuntimeException {
    private final StorageErrorKind kind;

    public StorageException(String message) {
        this(StorageErrorKind.IO, message, null);
    }

    public StorageException(String message, Throwable cause) {
        this(StorageErrorKind.IO, message, cause);
    }

    protected StorageException(StorageErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public StorageErrorKind getKind() {
        return kind;
    }
}
