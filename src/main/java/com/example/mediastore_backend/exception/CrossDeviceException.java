package com.example.mediastore_backend.exception;

/** Atomic rename refused because source and target live on different volumes. */
public class CrossDeviceException extends StorageException {

    public CrossDeviceException(String message) {
        super(StorageErrorKind.CROSS_DEVICE, message, null);
    }

    public CrossDeviceException(String message, Throwable cause) {
        super(StorageErrorKind.CROSS_DEVICE, message, cause);
    }
}
