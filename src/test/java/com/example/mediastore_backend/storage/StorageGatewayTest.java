package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.ObjectStoreProperties;
import com.example.mediastore_backend.config.StorageProperties;
import com.example.mediastore_backend.exception.StorageAlreadyExistsException;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import com.example.mediastore_backend.exception.UnsupportedStorageOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StorageGatewayTest {

    private static final String REMOTE_A = "t3.storage.dev/media/library/a.jpg";
    private static final String REMOTE_B = "t3.storage.dev/media/library/b.jpg";

    @TempDir
    Path tempDir;

    @Mock
    private S3Client s3;

    private Path scratch;
    private StorageGateway gateway;

    @BeforeEach
    void setUp() {
        scratch = tempDir.resolve("scratch");
        StorageProperties properties = new StorageProperties();
        properties.setTempDir(scratch.toString());
        properties.setSupportedExtensions(List.of("jpg", ".png", ".MP4"));
        ObjectStoreProperties objectStore = new ObjectStoreProperties();
        objectStore.setTigris(new ObjectStoreProperties.Credentials("id", "secret"));
        ObjectStorageBackend remote = new ObjectStorageBackend(new ObjectStoreClientCache(objectStore, e -> s3), objectStore);
        gateway = new StorageGateway(new LocalStorageBackend(), remote, properties);
    }

    @Test
    void localWriteAndReadRoundTrip() {
        String file = tempDir.resolve("notes.xmp").toString();

        gateway.createFile(file, bytes("<xmp/>"));
        assertThrows(StorageAlreadyExistsException.class, () -> gateway.createFile(file, bytes("again")));
        gateway.overwriteFile(file, bytes("<x/>"));

        assertThat(gateway.readTextFile(file)).isEqualTo("<x/>");
        assertThat(gateway.checkFileExists(file)).isTrue();
        assertThat(gateway.stat(file).size()).isEqualTo(4);
    }

    @Test
    void localCreateOrOverwriteAndRangedRead() {
        String file = tempDir.resolve("data.bin").toString();

        gateway.createOrOverwriteFile(file, bytes("first version"));
        gateway.createOrOverwriteFile(file, bytes("0123456789"));

        assertThat(gateway.readFile(file)).isEqualTo(bytes("0123456789"));
        assertThat(gateway.readFile(file, 3, 4)).isEqualTo(bytes("3456"));
        assertThat(gateway.readFile(file, 8, 10)).isEqualTo(bytes("89"));
    }

    @Test
    void realPathResolvesLocalLinks() throws Exception {
        Path target = Files.writeString(tempDir.resolve("real.jpg"), "x");
        Path link = Files.createSymbolicLink(tempDir.resolve("link.jpg"), target);

        assertThat(gateway.realPath(link.toString())).isEqualTo(target.toRealPath().toString());
        assertThrows(StorageNotFoundException.class, () -> gateway.realPath(tempDir.resolve("missing.jpg").toString()));
    }

    @Test
    void unlinkOfMissingLocalFileOnlyWarns() {
        gateway.unlink(tempDir.resolve("never-existed.jpg").toString());
    }

    @Test
    void uploadFromStreamCountsAndHashes() throws Exception {
        byte[] content = bytes("original image bytes");
        String destination = tempDir.resolve("upload/owner/ab/cd/file.jpg").toString();

        UploadResult result = gateway.uploadFromStream(new ByteArrayInputStream(content), destination, UploadOptions.withChecksum());

        assertThat(result.path()).isEqualTo(destination);
        assertThat(result.size()).isEqualTo(content.length);
        assertThat(result.checksum()).isEqualTo(MessageDigest.getInstance("SHA-1").digest(content));
        assertThat(Files.readAllBytes(Path.of(destination))).isEqualTo(content);
    }

    @Test
    void uploadWithoutChecksumLeavesItNull() {
        UploadResult result = gateway.uploadFromStream(new ByteArrayInputStream(bytes("x")),
                tempDir.resolve("y.jpg").toString(), UploadOptions.defaults());

        assertThat(result.checksum()).isNull();
    }

    @Test
    void remoteUploadGoesThroughObjectStore() {
        UploadResult result = gateway.uploadFromStream(new ByteArrayInputStream(bytes("abc")), REMOTE_A, UploadOptions.defaults());

        assertThat(result.size()).isEqualTo(3);
        verify(s3).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void renameAcrossBucketsIsRejectedBeforeAnyRequest() {
        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.rename(REMOTE_A, "t3.storage.dev/other/library/a.jpg"));
        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.rename(REMOTE_A, tempDir.resolve("a.jpg").toString()));
        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.copyFile(tempDir.resolve("a.jpg").toString(), REMOTE_A));

        verifyNoInteractions(s3);
    }

    @Test
    void remoteRenameCopiesVerifiesThenDeletes() {
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(7L).build());

        gateway.rename(REMOTE_A, REMOTE_B);

        InOrder order = inOrder(s3);
        order.verify(s3).headObject(any(HeadObjectRequest.class));
        order.verify(s3).copyObject(any(CopyObjectRequest.class));
        order.verify(s3).headObject(any(HeadObjectRequest.class));
        order.verify(s3).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void remoteRenameKeepsSourceWhenCopyIsShort() {
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(7L).build())
                .thenReturn(HeadObjectResponse.builder().contentLength(3L).build());

        assertThrows(StorageException.class, () -> gateway.rename(REMOTE_A, REMOTE_B));

        verify(s3, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void remoteCreateRefusesExistingObject() {
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(1L).build());

        assertThrows(StorageAlreadyExistsException.class, () -> gateway.createFile(REMOTE_A, bytes("x")));

        verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void writeFilePassesLocalPathsThrough() {
        String target = tempDir.resolve("sidecar.xmp").toString();

        String seen = gateway.writeFile(target, path -> {
            Files.writeString(Path.of(path), "xmp");
            return path;
        });

        assertThat(seen).isEqualTo(target);
        assertThat(gateway.readTextFile(target)).isEqualTo("xmp");
    }

    @Test
    void writeFileToRemoteUploadsAndCleansUpTempFile() throws Exception {
        String seen = gateway.writeFile(REMOTE_A, path -> {
            Files.writeString(Path.of(path), "rendered");
            return path;
        });

        assertThat(seen).startsWith(scratch.toString()).endsWith("a.jpg");
        assertThat(Path.of(seen)).doesNotExist();
        verify(s3).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        try (Stream<Path> left = Files.list(scratch)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    void withLocalPathDownloadsRemoteFile() {
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
                GetObjectResponse.builder().contentLength(6L).build(),
                AbortableInputStream.create(new ByteArrayInputStream(bytes("remote")))));

        String content = gateway.withLocalPath(REMOTE_A, path -> Files.readString(Path.of(path)));

        assertThat(content).isEqualTo("remote");
    }

    @Test
    void callbackFailureBecomesStorageException() {
        String target = tempDir.resolve("missing-dir/file.jpg").toString();

        assertThrows(StorageException.class,
                () -> gateway.writeFile(target, path -> Files.writeString(Path.of(path), "x")));
    }

    @Test
    void crawlFiltersExtensionsHiddenAndExclusions() throws Exception {
        Path root = tempDir.resolve("import");
        write(root.resolve("a.jpg"));
        write(root.resolve("b.mp4"));
        write(root.resolve("c.txt"));
        write(root.resolve(".hidden/d.jpg"));
        write(root.resolve("sub/e.PNG"));
        write(root.resolve("sub/skip/f.jpg"));

        List<String> found = gateway.crawl(new CrawlOptions(List.of(root.toString()), List.of("**/skip/**"), false));

        assertThat(found).containsExactlyInAnyOrder(
                root.resolve("a.jpg").toString(),
                root.resolve("b.mp4").toString(),
                root.resolve("sub/e.PNG").toString());

        List<String> withHidden = gateway.crawl(new CrawlOptions(List.of(root.toString()), List.of(), true));
        assertThat(withHidden).contains(root.resolve(".hidden/d.jpg").toString(), root.resolve("sub/skip/f.jpg").toString());
    }

    @Test
    void crawlSkipsMissingRootsAndRejectsRemoteOnes() {
        assertThat(gateway.crawl(new CrawlOptions(List.of(tempDir.resolve("nope").toString()), null, false))).isEmpty();
        assertThat(gateway.crawl(new CrawlOptions(List.of(), null, false))).isEmpty();
        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.crawl(new CrawlOptions(List.of("t3.storage.dev/media/library"), null, false)));
    }

    @Test
    void walkEmitsBatchesOfTake() throws Exception {
        Path root = tempDir.resolve("walk");
        write(root.resolve("1.jpg"));
        write(root.resolve("2.jpg"));
        write(root.resolve("3.jpg"));

        List<List<String>> batches;
        try (Stream<List<String>> walk = gateway.walk(new WalkOptions(List.of(root.toString()), null, false, 2))) {
            batches = walk.toList();
        }

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0)).hasSize(2);
        assertThat(batches.get(1)).hasSize(1);
    }

    @Test
    void remoteDiskUsageIsUnbounded() {
        DiskUsage usage = gateway.checkDiskUsage("t3.storage.dev/media");

        assertThat(usage.available()).isEqualTo(Long.MAX_VALUE);
        assertThat(usage.total()).isEqualTo(Long.MAX_VALUE);
        verifyNoInteractions(s3);
    }

    @Test
    void remoteDirectoryOperationsAreNoOpsOrUnsupported() {
        gateway.mkdirs("t3.storage.dev/media/thumbs");
        gateway.removeEmptyDirs("t3.storage.dev/media/thumbs", false);
        gateway.ensureParentFolder(REMOTE_A);

        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.unlinkDir("t3.storage.dev/media/thumbs", true, true));
        verifyNoInteractions(s3);
    }

    @Test
    void watchReportsExistingFilesWhenAsked() throws Exception {
        Path root = tempDir.resolve("watched");
        write(root.resolve("existing.jpg"));
        CountDownLatch ready = new CountDownLatch(1);
        List<String> added = new CopyOnWriteArrayList<>();

        try (Closeable ignored = gateway.watch(List.of(root.toString()), new WatchOptions(true, false), new WatchEvents() {
            @Override
            public void onReady() {
                ready.countDown();
            }

            @Override
            public void onAdd(String path) {
                added.add(path);
            }
        })) {
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(added).contains(root.resolve("existing.jpg").toString());
    }

    @Test
    void watchRejectsMissingAndRemoteRoots() {
        WatchEvents none = new WatchEvents() {
        };

        assertThrows(StorageNotFoundException.class,
                () -> gateway.watch(List.of(tempDir.resolve("absent").toString()), WatchOptions.defaults(), none));
        assertThrows(UnsupportedStorageOperationException.class,
                () -> gateway.watch(List.of("t3.storage.dev/media/library"), WatchOptions.defaults(), none));
    }

    private static void write(Path file) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
