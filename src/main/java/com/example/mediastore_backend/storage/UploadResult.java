package com.example.mediastore_backend.storage;

/**
 * Outcome of {@link StorageGateway#uploadFromStream}; {@code checksum} is the SHA-1 of the
 * transferred bytes, or {@code null} when it was not requested.
 */
public record UploadResult(String path, long size, byte[] checksum) {
}
