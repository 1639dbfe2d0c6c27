package com.example.mediastore_backend.storage;

import java.time.Instant;

/**
 * Backend-neutral file attributes.
 */
public record FileStat(long size, Instant mtime, Instant atime, Instant birthtime, boolean directory) {

    public boolean isFile() {
        return !directory;
    }
}
