package com.example.mediastore_backend.exception;

/** Operation spans two backends or two buckets, or is not available on the backend. */
public class UnsupportedStorageOperationException extends StorageException {

    public UnsupportedStorageOperationException(String message) {
        super(StorageErrorKind.UNSUPPORTED_OPERATION, message, null);
    }

    public UnsupportedStorageOperationException(String message, Throwable cause) {
        super(StorageErrorKind.UNSUPPORTED_OPERATION, message, cause);
    }
}
