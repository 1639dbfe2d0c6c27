package com.example.mediastore_backend.layout;

import com.example.mediastore_backend.storage.StoragePaths;

import java.nio.file.Path;

/**
 * Root under which all managed files live. Either an absolute local directory or a remote
 * {@code host/bucket} pair; in the latter case everything below the root becomes the object key.
 */
public record MediaLocation(String root, boolean remote) {

    public MediaLocation {
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("Media location must not be blank");
        }
    }

    /**
     * Parses a configured location. Local locations are made absolute so every computed path
     * starts with {@code /}.
     */
    public static MediaLocation of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Media location must not be blank");
        }
        String trimmed = raw.trim();
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (!trimmed.startsWith(".") && StoragePaths.isRemoteRoot(trimmed)) {
            return new MediaLocation(trimmed, true);
        }
        return new MediaLocation(Path.of(trimmed).toAbsolutePath().normalize().toString(), false);
    }

    /** Appends a relative path, ignoring a leading slash on it. */
    public String resolve(String relative) {
        String rel = relative.startsWith("/") ? relative.substring(1) : relative;
        if (rel.isEmpty()) {
            return root;
        }
        return root.endsWith("/") ? root + rel : root + "/" + rel;
    }

    @Override
    public String toString() {
        return root;
    }
}
