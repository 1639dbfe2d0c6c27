package com.example.mediastore_backend.storage;

public record UploadOptions(boolean computeChecksum) {

    public static UploadOptions defaults() {
        return new UploadOptions(false);
    }

    public static UploadOptions withChecksum() {
        return new UploadOptions(true);
    }
}
