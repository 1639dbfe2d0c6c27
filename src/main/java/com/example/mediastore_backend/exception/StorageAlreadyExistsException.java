package com.example.mediastore_backend.exception;

public class StorageAlreadyExistsException extends StorageException {

    public StorageAlreadyExistsException(String message) {
        super(StorageErrorKind.ALREADY_EXISTS, message, null);
    }

    public StorageAlreadyExistsException(String message, Throwable cause) {
        super(StorageErrorKind.ALREADY_EXISTS, message, cause);
    }
}
