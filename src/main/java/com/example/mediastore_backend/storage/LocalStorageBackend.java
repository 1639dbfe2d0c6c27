package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.exception.CrossDeviceException;
import com.example.mediastore_backend.exception.StorageAlreadyExistsException;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.COPY_ATTRIBUTES;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Filesystem backend. Every {@link IOException} is converted here, exactly once, into the
 * storage exception hierarchy.
 */
public class LocalStorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageBackend.class);

    public byte[] read(String file) {
        Path p = Path.of(file);
        try {
            return Files.readAllBytes(p);
        } catch (IOException e) {
            throw translate("Read failed", p, e);
        }
    }

    public byte[] read(String file, long offset, int length) {
        Path p = Path.of(file);
        try (FileChannel channel = FileChannel.open(p, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(length);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            byte[] out = new byte[buffer.position()];
            buffer.flip();
            buffer.get(out);
            return out;
        } catch (IOException e) {
            throw translate("Read failed", p, e);
        }
    }

    public String readText(String file) {
        return new String(read(file), StandardCharsets.UTF_8);
    }

    public void createExclusive(String file, byte[] content) {
        write(file, content, CREATE_NEW, WRITE);
    }

    public void createOrOverwrite(String file, byte[] content) {
        write(file, content, CREATE, TRUNCATE_EXISTING, WRITE);
    }

    /** Replaces the content of an existing file; fails when the file is missing. */
    public void overwrite(String file, byte[] content) {
        write(file, content, TRUNCATE_EXISTING, WRITE);
    }

    private void write(String file, byte[] content, OpenOption... options) {
        Path p = Path.of(file);
        try {
            Files.write(p, content, options);
        } catch (IOException e) {
            throw translate("Write failed", p, e);
        }
    }

    public InputStream openInputStream(String file) {
        Path p = Path.of(file);
        try {
            return Files.newInputStream(p);
        } catch (IOException e) {
            throw translate("Open for read failed", p, e);
        }
    }

    public OutputStream openOutputStream(String file) {
        Path p = Path.of(file);
        try {
            return Files.newOutputStream(p, CREATE, TRUNCATE_EXISTING, WRITE);
        } catch (IOException e) {
            throw translate("Open for write failed", p, e);
        }
    }

    public FileStat stat(String file) {
        Path p = Path.of(file);
        try {
            BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
            return new FileStat(
                    attrs.size(),
                    attrs.lastModifiedTime().toInstant(),
                    attrs.lastAccessTime().toInstant(),
                    attrs.creationTime().toInstant(),
                    attrs.isDirectory());
        } catch (IOException e) {
            throw translate("Stat failed", p, e);
        }
    }

    public boolean exists(String file) {
        return Files.exists(Path.of(file));
    }

    /**
     * Atomic rename within one filesystem.
     *
     * @throws CrossDeviceException when source and target are on different volumes.
     */
    public void rename(String source, String target) {
        Path src = Path.of(source);
        Path dst = Path.of(target);
        try {
            Files.move(src, dst, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw new CrossDeviceException("Cannot rename across devices: " + src + " -> " + dst, e);
        } catch (FileSystemException e) {
            if (isCrossDevice(e)) {
                throw new CrossDeviceException("Cannot rename across devices: " + src + " -> " + dst, e);
            }
            throw translate("Rename failed to " + dst + " from", src, e);
        } catch (IOException e) {
            throw translate("Rename failed to " + dst + " from", src, e);
        }
    }

    public void copy(String source, String target) {
        Path src = Path.of(source);
        Path dst = Path.of(target);
        try {
            Files.copy(src, dst, REPLACE_EXISTING, COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw translate("Copy failed to " + dst + " from", src, e);
        }
    }

    /**
     * @throws StorageNotFoundException when the file does not exist.
     */
    public void delete(String file) {
        Path p = Path.of(file);
        try {
            Files.delete(p);
        } catch (IOException e) {
            throw translate("Delete failed", p, e);
        }
    }

    public void deleteDirectory(String folder, boolean recursive, boolean force) {
        Path dir = Path.of(folder);
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            if (force) {
                return;
            }
            throw new StorageNotFoundException("Directory does not exist: " + dir);
        }
        if (!recursive) {
            delete(folder);
            return;
        }
        try (Stream<Path> tree = Files.walk(dir)) {
            List<Path> paths = tree.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw translate("Recursive delete failed", dir, e);
        }
    }

    public void mkdirs(String folder) {
        Path dir = Path.of(folder);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw translate("Cannot create directory", dir, e);
        }
    }

    public void setTimes(String file, Instant atime, Instant mtime) {
        Path p = Path.of(file);
        try {
            Files.getFileAttributeView(p, BasicFileAttributeView.class)
                    .setTimes(FileTime.from(mtime), FileTime.from(atime), null);
        } catch (IOException e) {
            throw translate("Cannot set timestamps", p, e);
        }
    }

    public String realPath(String file) {
        Path p = Path.of(file);
        try {
            return p.toRealPath().toString();
        } catch (IOException e) {
            throw translate("Cannot resolve real path", p, e);
        }
    }

    public DiskUsage diskUsage(String folder) {
        Path p = Path.of(folder);
        try {
            FileStore store = Files.getFileStore(p);
            return new DiskUsage(store.getUsableSpace(), store.getUnallocatedSpace(), store.getTotalSpace());
        } catch (IOException e) {
            throw translate("Cannot read disk usage", p, e);
        }
    }

    /**
     * Deletes empty directories below {@code folder}, depth first. The folder itself is only
     * removed when {@code self} is set. Symbolic links are never followed.
     */
    public void removeEmptyDirs(String folder, boolean self) {
        Path dir = Path.of(folder);
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try {
            List<Path> children;
            try (Stream<Path> list = Files.list(dir)) {
                children = list.toList();
            }
            for (Path child : children) {
                removeEmptyDirs(child.toString(), true);
            }
            if (self && isEmptyDirectory(dir)) {
                Files.delete(dir);
                LOGGER.debug("Removed empty directory {}", dir);
            }
        } catch (IOException e) {
            throw translate("Cannot prune directory", dir, e);
        }
    }

    private boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> list = Files.list(dir)) {
            return list.findFirst().isEmpty();
        }
    }

    private static boolean isCrossDevice(FileSystemException e) {
        String reason = e.getReason();
        return reason != null && (reason.contains("cross-device") || reason.contains("EXDEV"));
    }

    static StorageException translate(String action, Path path, IOException e) {
        if (e instanceof NoSuchFileException) {
            return new StorageNotFoundException(action + ": " + path + " does not exist", e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return new StorageAlreadyExistsException(action + ": " + path + " already exists", e);
        }
        return new StorageException(action + ": " + path, e);
    }
}
