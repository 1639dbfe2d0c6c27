package com.example.mediastore_backend.exception;

public class StorageNotFoundException extends StorageException {

    public StorageNotFoundException(String message) {
        super(StorageErrorKind.NOT_FOUND, message, null);
    }

    public StorageNotFoundException(String message, Throwable cause) {
        super(StorageErrorKind.NOT_FOUND, message, cause);
    }
}
