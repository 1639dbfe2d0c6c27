package com.example.mediastore_backend.exception;

public class MalformedPathException extends StorageException {

    public MalformedPathException(String message) {
        super(StorageErrorKind.MALFORMED_PATH, message, null);
    }

    public MalformedPathException(String message, Throwable cause) {
        super(StorageErrorKind.MALFORMED_PATH, message, cause);
    }
}
