package com.example.mediastore_backend.layout;

import com.example.mediastore_backend.storage.StoragePaths;
import com.example.mediastore_backend.util.PathType;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Canonical locations of managed files. Derived files are fanned out over two directory levels
 * taken from the first four characters of the file name:
 * {@code <root>/<folder>/<owner>/<fn[0..2]>/<fn[2..4]>/<fn>}.
 *
 * <p>All methods are pure; the media location is always passed in.
 */
public final class StorageLayout {

    private StorageLayout() {
    }

    public static String getBaseFolder(MediaLocation location, StorageFolder folder) {
        return location.resolve(folder.folderName());
    }

    public static String getFolderLocation(MediaLocation location, StorageFolder folder, UUID ownerId) {
        return join(getBaseFolder(location, folder), ownerId.toString());
    }

    /** Library folder of a user; the storage label, when set, replaces the user id. */
    public static String getLibraryFolder(MediaLocation location, String storageLabel, UUID ownerId) {
        String name = storageLabel == null || storageLabel.isBlank() ? ownerId.toString() : storageLabel;
        return join(getBaseFolder(location, StorageFolder.LIBRARY), name);
    }

    public static String getNestedFolder(MediaLocation location, StorageFolder folder, UUID ownerId, String filename) {
        int len = filename.length();
        String first = filename.substring(0, Math.min(2, len));
        String second = filename.substring(Math.min(2, len), Math.min(4, len));
        return join(join(getFolderLocation(location, folder, ownerId), first), second);
    }

    public static String getNestedPath(MediaLocation location, StorageFolder folder, UUID ownerId, String filename) {
        return join(getNestedFolder(location, folder, ownerId, filename), filename);
    }

    /**
     * @param type one of the generated image kinds (full size, preview, thumbnail).
     */
    public static String getImagePath(MediaLocation location, PathOwner entity, PathType type, ImageFormat format) {
        if (!type.isGeneratedImage()) {
            throw new IllegalArgumentException("Not a generated image type: " + type);
        }
        String filename = entity.getId() + "-" + type.value() + "." + format.extension();
        return getNestedPath(location, StorageFolder.THUMBNAILS, entity.getOwnerId(), filename);
    }

    public static String getEncodedVideoPath(MediaLocation location, PathOwner entity) {
        return getNestedPath(location, StorageFolder.ENCODED_VIDEO, entity.getOwnerId(), entity.getId() + ".mp4");
    }

    /** Video part extracted from an Android motion photo. */
    public static String getAndroidMotionPath(MediaLocation location, PathOwner entity, UUID uuid) {
        return getNestedPath(location, StorageFolder.ENCODED_VIDEO, entity.getOwnerId(), uuid + "-MP.mp4");
    }

    public static String getPersonThumbnailPath(MediaLocation location, PathOwner person) {
        return getNestedPath(location, StorageFolder.THUMBNAILS, person.getOwnerId(), person.getId() + ".jpeg");
    }

    public static boolean isAndroidMotionPath(MediaLocation location, String originalPath) {
        String folder = StorageFolder.ENCODED_VIDEO.folderName();
        if (StoragePaths.isRemote(originalPath)) {
            return originalPath.contains("/" + folder + "/");
        }
        return isUnder(originalPath, getBaseFolder(location, StorageFolder.ENCODED_VIDEO));
    }

    /**
     * Whether the path is managed storage: any remote object path, or a local path below the
     * media location.
     */
    public static boolean isMediaPath(MediaLocation location, String path) {
        if (StoragePaths.isRemote(path)) {
            return true;
        }
        if (!path.startsWith("/")) {
            return false;
        }
        String normalized = Path.of(path).normalize().toString();
        return normalized.equals(location.root()) || isUnder(normalized, location.root());
    }

    public static String getTempPathInDir(String dir) {
        return join(dir, UUID.randomUUID() + ".tmp");
    }

    private static boolean isUnder(String path, String folder) {
        String prefix = folder.endsWith("/") ? folder : folder + "/";
        return path.startsWith(prefix);
    }

    private static String join(String parent, String child) {
        if (child.isEmpty()) {
            return parent;
        }
        return parent.endsWith("/") ? parent + child : parent + "/" + child;
    }
}
