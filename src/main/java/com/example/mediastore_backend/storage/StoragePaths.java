package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.exception.MalformedPathException;

/**
 * Classifies logical path strings. Local paths start with {@code /}; remote paths look like
 * {@code host/bucket/key...} with a dotted host. Anything else is a local relative path.
 */
public final class StoragePaths {

    private StoragePaths() {
    }

    public static boolean isRemote(String path) {
        if (path == null || path.isEmpty() || path.startsWith("/")) {
            return false;
        }
        String[] parts = path.split("/", -1);
        return parts.length >= 3 && parts[0].contains(".");
    }

    /** Like {@link #isRemote}, but also accepts a bare {@code host/bucket} storage root. */
    public static boolean isRemoteRoot(String path) {
        return isRemote(path) || (path != null && !path.isEmpty() && isRemote(path + "/"));
    }

    public static boolean isLocal(String path) {
        return !isRemote(path);
    }

    public static RemotePath parse(String path) {
        if (path == null) {
            throw new MalformedPathException("Remote path is null");
        }
        String[] parts = path.split("/", 3);
        if (parts.length < 3) {
            throw new MalformedPathException("Invalid remote storage path: " + path);
        }
        return new RemotePath(parts[0], parts[1], parts[2]);
    }

    /** Last path segment, for both local and remote paths. */
    public static String basename(String path) {
        int i = path.lastIndexOf('/');
        return i < 0 ? path : path.substring(i + 1);
    }
}
