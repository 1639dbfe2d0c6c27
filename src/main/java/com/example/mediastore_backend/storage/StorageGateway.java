package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.StorageProperties;
import com.example.mediastore_backend.exception.StorageAlreadyExistsException;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import com.example.mediastore_backend.exception.UnsupportedStorageOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Single entry point for file access. Every operation inspects its path with
 * {@link StoragePaths#isRemote} and dispatches to the local filesystem or to the object store
 * named by the path's host. Callers never see which backend served them, except through the
 * capability limits documented per method.
 */
public class StorageGateway {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageGateway.class);

    private final LocalStorageBackend local;
    private final ObjectStorageBackend remote;
    private final Path tempDir;
    private final Set<String> supportedExtensions;

    public StorageGateway(LocalStorageBackend local, ObjectStorageBackend remote, StorageProperties properties) {
        this.local = local;
        this.remote = remote;
        this.tempDir = Path.of(properties.getTempDir());
        this.supportedExtensions = properties.getSupportedExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toUnmodifiableSet());
    }

    // ---- reads ----

    public byte[] readFile(String path) {
        if (StoragePaths.isRemote(path)) {
            return remote.getBytes(StoragePaths.parse(path));
        }
        return local.read(path);
    }

    /** Reads up to {@code length} bytes starting at {@code offset}. */
    public byte[] readFile(String path, long offset, int length) {
        if (StoragePaths.isRemote(path)) {
            return remote.getRange(StoragePaths.parse(path), offset, length);
        }
        return local.read(path, offset, length);
    }

    public String readTextFile(String path) {
        if (StoragePaths.isRemote(path)) {
            return new String(readFile(path), StandardCharsets.UTF_8);
        }
        return local.readText(path);
    }

    /**
     * Opens the file for streaming. {@code mimeType} wins over whatever the backend reports.
     * The caller closes the returned stream.
     */
    public ReadStream createReadStream(String path, String mimeType) {
        if (StoragePaths.isRemote(path)) {
            ObjectContent content = remote.get(StoragePaths.parse(path));
            String type = mimeType != null ? mimeType : content.contentType();
            return new ReadStream(content.stream(), content.length(), type);
        }
        FileStat stat = local.stat(path);
        return new ReadStream(local.openInputStream(path), stat.size(), mimeType);
    }

    public FileStat stat(String path) {
        if (StoragePaths.isRemote(path)) {
            return remote.stat(StoragePaths.parse(path));
        }
        return local.stat(path);
    }

    public boolean checkFileExists(String path) {
        if (StoragePaths.isRemote(path)) {
            return remote.exists(StoragePaths.parse(path));
        }
        return local.exists(path);
    }

    /** Canonical local path; remote paths are returned as given. */
    public String realPath(String path) {
        if (StoragePaths.isRemote(path)) {
            return path;
        }
        return local.realPath(path);
    }

    // ---- writes ----

    /**
     * @throws StorageAlreadyExistsException when the target exists.
     */
    public void createFile(String path, byte[] content) {
        if (StoragePaths.isRemote(path)) {
            RemotePath target = StoragePaths.parse(path);
            if (remote.exists(target)) {
                throw new StorageAlreadyExistsException("Object already exists: " + path);
            }
            remote.put(target, content);
            return;
        }
        local.createExclusive(path, content);
    }

    public void createOrOverwriteFile(String path, byte[] content) {
        if (StoragePaths.isRemote(path)) {
            remote.put(StoragePaths.parse(path), content);
            return;
        }
        local.createOrOverwrite(path, content);
    }

    /**
     * Replaces the content of an existing file.
     *
     * @throws StorageNotFoundException when the file does not exist.
     */
    public void overwriteFile(String path, byte[] content) {
        if (StoragePaths.isRemote(path)) {
            RemotePath target = StoragePaths.parse(path);
            remote.head(target);
            remote.put(target, content);
            return;
        }
        local.overwrite(path, content);
    }

    /**
     * Streams {@code stream} to {@code destination}, counting the bytes and, when requested,
     * computing their SHA-1 on the way. The input stream is consumed but not closed.
     */
    public UploadResult uploadFromStream(InputStream stream, String destination, UploadOptions options) {
        MeteredInputStream metered = new MeteredInputStream(stream, options != null && options.computeChecksum());
        if (StoragePaths.isRemote(destination)) {
            remote.putStream(StoragePaths.parse(destination), metered);
        } else {
            ensureParentFolder(destination);
            try (OutputStream out = local.openOutputStream(destination)) {
                metered.transferTo(out);
            } catch (IOException e) {
                throw new StorageException("Upload to " + destination + " failed", e);
            }
        }
        LOGGER.debug("UPLOAD DONE path={} size={}", destination, metered.count());
        return new UploadResult(destination, metered.count(), metered.checksum());
    }

    // ---- relocation ----

    /**
     * Moves {@code source} to {@code target}. Local renames are atomic; remote renames within a
     * bucket are copy, verify, delete. Anything else is rejected before any I/O happens.
     *
     * @throws UnsupportedStorageOperationException across backends or buckets.
     */
    public void rename(String source, String target) {
        boolean srcRemote = StoragePaths.isRemote(source);
        boolean dstRemote = StoragePaths.isRemote(target);
        if (!srcRemote && !dstRemote) {
            local.rename(source, target);
            return;
        }
        if (srcRemote != dstRemote) {
            throw new UnsupportedStorageOperationException(
                    "Cannot rename between local and remote storage: " + source + " -> " + target);
        }
        RemotePath src = StoragePaths.parse(source);
        RemotePath dst = StoragePaths.parse(target);
        if (!src.sameBucket(dst)) {
            throw new UnsupportedStorageOperationException(
                    "Cannot rename across buckets: " + source + " -> " + target);
        }
        long expected = remote.head(src).length();
        remote.copy(src, dst);
        long copied = remote.head(dst).length();
        if (copied != expected) {
            throw new StorageException("Copy of " + source + " to " + target + " is incomplete: expected "
                    + expected + " bytes, found " + copied);
        }
        remote.delete(src);
    }

    /**
     * @throws UnsupportedStorageOperationException across backends or buckets.
     */
    public void copyFile(String source, String target) {
        boolean srcRemote = StoragePaths.isRemote(source);
        boolean dstRemote = StoragePaths.isRemote(target);
        if (!srcRemote && !dstRemote) {
            local.copy(source, target);
            return;
        }
        if (srcRemote != dstRemote) {
            throw new UnsupportedStorageOperationException(
                    "Cannot copy between local and remote storage: " + source + " -> " + target);
        }
        RemotePath src = StoragePaths.parse(source);
        RemotePath dst = StoragePaths.parse(target);
        if (!src.sameBucket(dst)) {
            throw new UnsupportedStorageOperationException(
                    "Cannot copy across buckets: " + source + " -> " + target);
        }
        remote.copy(src, dst);
    }

    public void utimes(String path, Instant atime, Instant mtime) {
        if (StoragePaths.isRemote(path)) {
            remote.setTimes(StoragePaths.parse(path), atime, mtime);
            return;
        }
        local.setTimes(path, atime, mtime);
    }

    // ---- removal ----

    /** Deletes a file. A missing local file is only logged. */
    public void unlink(String path) {
        if (StoragePaths.isRemote(path)) {
            try {
                remote.delete(StoragePaths.parse(path));
            } catch (StorageException e) {
                LOGGER.warn("UNLINK FAILED path={} error={}", path, e.getMessage());
                throw e;
            }
            return;
        }
        try {
            local.delete(path);
        } catch (StorageNotFoundException e) {
            LOGGER.warn("File {} does not exist.", path);
        }
    }

    /**
     * @throws UnsupportedStorageOperationException for remote paths; object stores have no directories.
     */
    public void unlinkDir(String folder, boolean recursive, boolean force) {
        if (StoragePaths.isRemote(folder)) {
            throw new UnsupportedStorageOperationException("Directories do not exist on object storage: " + folder);
        }
        local.deleteDirectory(folder, recursive, force);
    }

    /** No-op for remote paths. */
    public void removeEmptyDirs(String folder, boolean self) {
        if (StoragePaths.isRemote(folder)) {
            LOGGER.debug("Skipping empty directory removal for remote path {}", folder);
            return;
        }
        local.removeEmptyDirs(folder, self);
    }

    /** No-op for remote paths; object keys need no parent. */
    public void mkdirs(String folder) {
        if (StoragePaths.isRemote(folder)) {
            return;
        }
        local.mkdirs(folder);
    }

    public void ensureParentFolder(String path) {
        if (StoragePaths.isRemote(path)) {
            return;
        }
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent != null) {
            local.mkdirs(parent.toString());
        }
    }

    // ---- local path adapters ----

    /**
     * Runs {@code callback} with a local path to write to. Local destinations are passed
     * through; remote ones get a temporary file that is uploaded after the callback returns.
     */
    public <T> T writeFile(String path, LocalFileCallback<T> callback) {
        if (!StoragePaths.isRemote(path)) {
            return invoke(callback, path);
        }
        RemotePath target = StoragePaths.parse(path);
        Path temp = tempFile("write", path);
        LOGGER.debug("Writing to temporary file {} for upload to {}", temp, path);
        try {
            T result = invoke(callback, temp.toString());
            try (InputStream in = local.openInputStream(temp.toString())) {
                remote.putStream(target, in);
            } catch (IOException e) {
                throw new StorageException("Upload of " + temp + " to " + path + " failed", e);
            }
            LOGGER.debug("Uploaded temporary file to {}", path);
            return result;
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Runs {@code callback} with a local copy of the file. Remote files are downloaded to a
     * temporary file first; local paths are passed through.
     */
    public <T> T withLocalPath(String path, LocalFileCallback<T> callback) {
        if (!StoragePaths.isRemote(path)) {
            return invoke(callback, path);
        }
        Path temp = tempFile("read", path);
        LOGGER.debug("Downloading {} to temporary file {}", path, temp);
        try {
            try (ObjectContent content = remote.get(StoragePaths.parse(path));
                 OutputStream out = local.openOutputStream(temp.toString())) {
                content.stream().transferTo(out);
            } catch (IOException e) {
                throw new StorageException("Download of " + path + " to " + temp + " failed", e);
            }
            return invoke(callback, temp.toString());
        } finally {
            deleteQuietly(temp);
        }
    }

    private Path tempFile(String mode, String path) {
        local.mkdirs(tempDir.toString());
        return tempDir.resolve("mediastore-" + mode + "-" + UUID.randomUUID() + "-" + StoragePaths.basename(path));
    }

    private static <T> T invoke(LocalFileCallback<T> callback, String localPath) {
        try {
            return callback.apply(localPath);
        } catch (IOException e) {
            throw new StorageException("Local file callback failed for " + localPath, e);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
            LOGGER.debug("Cleaned up temp file {}", temp);
        } catch (IOException e) {
            LOGGER.debug("Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }

    // ---- discovery ----

    /**
     * All supported media files below the given roots, as absolute paths.
     *
     * @throws UnsupportedStorageOperationException when a root is remote.
     */
    public List<String> crawl(CrawlOptions options) {
        if (options.pathsToCrawl().isEmpty()) {
            return List.of();
        }
        try (Stream<String> files = files(options)) {
            return new ArrayList<>(files.toList());
        } catch (UncheckedIOException e) {
            throw new StorageException("Crawl failed", e.getCause());
        }
    }

    /**
     * Lazy version of {@link #crawl}: emits lists of {@code take} paths, the last one possibly
     * shorter. The stream holds open directory handles and must be closed.
     */
    public Stream<List<String>> walk(WalkOptions options) {
        if (options.pathsToCrawl().isEmpty()) {
            return Stream.empty();
        }
        Stream<String> files = files(options.asCrawlOptions());
        Iterator<List<String>> batches = new PathBatchIterator(files.iterator(), options.take());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(batches, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(files::close);
    }

    private Stream<String> files(CrawlOptions options) {
        List<Path> roots = new ArrayList<>();
        for (String root : options.pathsToCrawl()) {
            if (StoragePaths.isRemote(root)) {
                throw new UnsupportedStorageOperationException("Crawling is not supported for remote storage: " + root);
            }
            roots.add(Path.of(root).toAbsolutePath().normalize());
        }
        List<PathMatcher> exclusions = options.exclusionPatterns().stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();
        boolean includeHidden = options.includeHidden();
        return roots.stream().flatMap(root -> tree(root)
                .filter(p -> includeHidden || !isHidden(root, p))
                .filter(Files::isRegularFile)
                .filter(this::hasSupportedExtension)
                .filter(p -> exclusions.stream().noneMatch(m -> m.matches(p)))
                .map(Path::toString));
    }

    private static Stream<Path> tree(Path root) {
        if (!Files.isDirectory(root)) {
            LOGGER.debug("Skipping missing crawl root {}", root);
            return Stream.empty();
        }
        try {
            return Files.walk(root);
        } catch (IOException e) {
            throw LocalStorageBackend.translate("Cannot walk", root, e);
        }
    }

    private static boolean isHidden(Path root, Path path) {
        for (Path segment : root.relativize(path)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private boolean hasSupportedExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && supportedExtensions.contains(name.substring(dot));
    }

    /**
     * Watches local directories for file changes until the returned handle is closed.
     *
     * @throws UnsupportedStorageOperationException when a path is remote.
     */
    public Closeable watch(List<String> paths, WatchOptions options, WatchEvents events) {
        List<Path> roots = new ArrayList<>();
        for (String path : paths) {
            if (StoragePaths.isRemote(path)) {
                throw new UnsupportedStorageOperationException("Watching is not supported for remote storage: " + path);
            }
            Path root = Path.of(path).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                throw new StorageNotFoundException("Watch root is not a directory: " + root);
            }
            roots.add(root);
        }
        try {
            return LocalFileWatcher.start(roots, options == null ? WatchOptions.defaults() : options, events);
        } catch (IOException e) {
            throw new StorageException("Cannot start watching " + paths, e);
        }
    }

    /** Local: filesystem figures. Remote: unbounded, reported as {@link Long#MAX_VALUE}. */
    public DiskUsage checkDiskUsage(String folder) {
        if (StoragePaths.isRemoteRoot(folder)) {
            return new DiskUsage(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);
        }
        return local.diskUsage(folder);
    }
}
