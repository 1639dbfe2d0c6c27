package com.example.mediastore_backend.service;

import com.example.mediastore_backend.util.PathType;

import java.util.Objects;
import java.util.UUID;

/**
 * @param oldPath   current location; {@code null} when the entity has no file of this type yet
 * @param assetInfo expected size and checksum of the content; required for {@link PathType#ORIGINAL}
 */
public record MoveRequest(UUID entityId, PathType pathType, String oldPath, String newPath, AssetInfo assetInfo) {

    public MoveRequest {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(pathType, "pathType");
        Objects.requireNonNull(newPath, "newPath");
    }

    public MoveRequest(UUID entityId, PathType pathType, String oldPath, String newPath) {
        this(entityId, pathType, oldPath, newPath, null);
    }

    /**
     * @param checksum SHA-1 of the content, may be {@code null}
     */
    public record AssetInfo(long sizeInBytes, byte[] checksum) {
    }
}
