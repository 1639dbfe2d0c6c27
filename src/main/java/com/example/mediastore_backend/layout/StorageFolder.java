package com.example.mediastore_backend.layout;

import java.util.Arrays;
import java.util.Locale;

/** Top-level folders below the media location. */
public enum StorageFolder {
    LIBRARY("library"),
    UPLOAD("upload"),
    PROFILE("profile"),
    THUMBNAILS("thumbs"),
    ENCODED_VIDEO("encoded-video"),
    BACKUPS("backups");

    private final String folderName;

    StorageFolder(String folderName) {
        this.folderName = folderName;
    }

    public String folderName() {
        return folderName;
    }

    /** Accepts the folder name ({@code thumbs}) as well as the constant name ({@code THUMBNAILS}). */
    public static StorageFolder fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Storage folder is required");
        }
        String v = raw.trim();
        return Arrays.stream(values())
                .filter(f -> f.folderName.equalsIgnoreCase(v) || f.name().equals(v.toUpperCase(Locale.ROOT).replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown storage folder: " + raw));
    }
}
