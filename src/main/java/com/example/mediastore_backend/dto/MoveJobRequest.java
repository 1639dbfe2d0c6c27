package com.example.mediastore_backend.dto;

import com.example.mediastore_backend.util.PathType;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * @param targetPath explicit destination; omit to use the canonical location of the path type
 */
public record MoveJobRequest(@NotNull UUID entityId, @NotNull PathType pathType, String targetPath) {
}
