package com.example.mediastore_backend.service;

import com.example.mediastore_backend.util.PathType;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owner of the recorded path of a tracked file. A relocation ends by handing the new path to the
 * store responsible for its path type.
 */
public interface EntityPathStore {

    Set<PathType> pathTypes();

    Optional<String> currentPath(PathType pathType, UUID entityId);

    void savePath(PathType pathType, UUID entityId, String newPath);
}
