package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.exception.StorageAlreadyExistsException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalStorageBackendTest {

    @TempDir
    Path tempDir;

    private final LocalStorageBackend backend = new LocalStorageBackend();

    @Test
    void createExclusiveRefusesExistingFile() {
        String file = tempDir.resolve("a.txt").toString();
        backend.createExclusive(file, bytes("one"));

        assertThrows(StorageAlreadyExistsException.class, () -> backend.createExclusive(file, bytes("two")));
        assertThat(backend.readText(file)).isEqualTo("one");
    }

    @Test
    void overwriteRequiresExistingFileAndTruncates() {
        String file = tempDir.resolve("b.txt").toString();
        assertThrows(StorageNotFoundException.class, () -> backend.overwrite(file, bytes("x")));

        backend.createOrOverwrite(file, bytes("longer content"));
        backend.overwrite(file, bytes("short"));

        assertThat(backend.readText(file)).isEqualTo("short");
    }

    @Test
    void rangedReadStopsAtEndOfFile() {
        String file = tempDir.resolve("digits.txt").toString();
        backend.createExclusive(file, bytes("0123456789"));

        assertThat(new String(backend.read(file, 3, 4), StandardCharsets.UTF_8)).isEqualTo("3456");
        assertThat(new String(backend.read(file, 8, 10), StandardCharsets.UTF_8)).isEqualTo("89");
        assertThat(backend.read(file, 20, 5)).isEmpty();
    }

    @Test
    void deleteOfMissingFileIsNotFound() {
        assertThrows(StorageNotFoundException.class, () -> backend.delete(tempDir.resolve("missing").toString()));
    }

    @Test
    void statOfMissingFileIsNotFound() {
        assertThrows(StorageNotFoundException.class, () -> backend.stat(tempDir.resolve("missing").toString()));
    }

    @Test
    void renameMovesFileWithinVolume() {
        String source = tempDir.resolve("src.jpg").toString();
        String target = tempDir.resolve("dst.jpg").toString();
        backend.createExclusive(source, bytes("jpeg"));

        backend.rename(source, target);

        assertThat(backend.exists(source)).isFalse();
        assertThat(backend.readText(target)).isEqualTo("jpeg");
    }

    @Test
    void setTimesIsVisibleThroughStat() {
        String file = tempDir.resolve("t.jpg").toString();
        backend.createExclusive(file, bytes("t"));
        Instant mtime = Instant.parse("2021-06-01T10:15:30Z");

        backend.setTimes(file, Instant.parse("2022-01-01T00:00:00Z"), mtime);

        FileStat stat = backend.stat(file);
        assertThat(stat.mtime()).isEqualTo(mtime);
        assertThat(stat.size()).isEqualTo(1);
        assertThat(stat.isFile()).isTrue();
    }

    @Test
    void removeEmptyDirsKeepsNonEmptyBranchesAndRoot() throws Exception {
        Files.createDirectories(tempDir.resolve("a/b/c"));
        Files.createDirectories(tempDir.resolve("d/e"));
        Files.writeString(tempDir.resolve("d/keep.jpg"), "x");

        backend.removeEmptyDirs(tempDir.toString(), false);

        assertThat(tempDir).exists();
        assertThat(tempDir.resolve("a")).doesNotExist();
        assertThat(tempDir.resolve("d/e")).doesNotExist();
        assertThat(tempDir.resolve("d/keep.jpg")).exists();
    }

    @Test
    void deleteDirectoryHonoursForceForMissingFolder() throws Exception {
        String missing = tempDir.resolve("gone").toString();
        backend.deleteDirectory(missing, true, true);
        assertThrows(StorageNotFoundException.class, () -> backend.deleteDirectory(missing, true, false));

        Files.createDirectories(tempDir.resolve("tree/sub"));
        Files.writeString(tempDir.resolve("tree/sub/f.jpg"), "x");
        backend.deleteDirectory(tempDir.resolve("tree").toString(), true, false);
        assertThat(tempDir.resolve("tree")).doesNotExist();
    }

    @Test
    void diskUsageReportsFileStoreFigures() {
        DiskUsage usage = backend.diskUsage(tempDir.toString());

        assertThat(usage.total()).isPositive();
        assertThat(usage.available()).isLessThanOrEqualTo(usage.total());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
