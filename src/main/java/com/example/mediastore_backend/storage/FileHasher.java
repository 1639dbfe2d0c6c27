package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.exception.StorageException;

import java.io.IOException;
import java.io.OutputStream;

/**
 * SHA-1 of a stored file, local or remote, computed while streaming.
 */
public class FileHasher {
    private final StorageGateway storage;

    public FileHasher(StorageGateway storage) {
        this.storage = storage;
    }

    public byte[] sha1(String path) {
        try (ReadStream file = storage.createReadStream(path, null);
             MeteredInputStream in = new MeteredInputStream(file.stream(), true)) {
            in.transferTo(OutputStream.nullOutputStream());
            return in.checksum();
        } catch (IOException e) {
            throw new StorageException("Cannot hash " + path, e);
        }
    }
}
