package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.ObjectStoreProperties;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObjectStorageBackendTest {

    private static final RemotePath PATH = StoragePaths.parse("t3.storage.dev/media/library/a.jpg");

    @Mock
    private S3Client s3;

    private ObjectStorageBackend backend;

    @BeforeEach
    void setUp() {
        ObjectStoreProperties properties = new ObjectStoreProperties();
        properties.setTigris(new ObjectStoreProperties.Credentials("id", "secret"));
        properties.setPartSizeBytes(ObjectStoreProperties.MIN_PART_SIZE);
        backend = new ObjectStorageBackend(new ObjectStoreClientCache(properties, endpoint -> s3), properties);
    }

    @Test
    void smallStreamIsASinglePut() {
        byte[] body = "small".getBytes(StandardCharsets.UTF_8);

        long size = backend.putStream(PATH, new ByteArrayInputStream(body));

        assertThat(size).isEqualTo(5);
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("media");
        assertThat(request.getValue().key()).isEqualTo("library/a.jpg");
        verify(s3, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
    }

    @Test
    void largeStreamIsUploadedInParts() {
        int partSize = (int) ObjectStoreProperties.MIN_PART_SIZE;
        byte[] body = new byte[partSize * 2 + 1024];
        when(s3.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-1").build());
        when(s3.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenReturn(UploadPartResponse.builder().eTag("etag").build());
        when(s3.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompleteMultipartUploadResponse.builder().build());

        long size = backend.putStream(PATH, new ByteArrayInputStream(body));

        assertThat(size).isEqualTo(body.length);
        ArgumentCaptor<UploadPartRequest> parts = ArgumentCaptor.forClass(UploadPartRequest.class);
        verify(s3, times(3)).uploadPart(parts.capture(), any(RequestBody.class));
        assertThat(parts.getAllValues()).extracting(UploadPartRequest::partNumber).containsExactly(1, 2, 3);
        assertThat(parts.getAllValues().get(2).contentLength()).isEqualTo(1024L);

        ArgumentCaptor<CompleteMultipartUploadRequest> complete = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3).completeMultipartUpload(complete.capture());
        assertThat(complete.getValue().uploadId()).isEqualTo("upload-1");
        assertThat(complete.getValue().multipartUpload().parts()).hasSize(3);
    }

    @Test
    void failedPartAbortsTheUpload() {
        byte[] body = new byte[(int) ObjectStoreProperties.MIN_PART_SIZE + 10];
        when(s3.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-2").build());
        when(s3.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(500).message("boom").build());

        StorageException ex = assertThrows(StorageException.class,
                () -> backend.putStream(PATH, new ByteArrayInputStream(body)));

        assertThat(ex.getKind().isRetryable()).isTrue();
        ArgumentCaptor<AbortMultipartUploadRequest> abort = ArgumentCaptor.forClass(AbortMultipartUploadRequest.class);
        verify(s3).abortMultipartUpload(abort.capture());
        assertThat(abort.getValue().uploadId()).isEqualTo("upload-2");
        verify(s3, never()).completeMultipartUpload(any(CompleteMultipartUploadRequest.class));
    }

    @Test
    void headOf404IsNotFound() {
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(404).message("Not Found").build());

        assertThrows(StorageNotFoundException.class, () -> backend.head(PATH));
    }

    @Test
    void existsIsFalseForMissingObject() {
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenThrow((NoSuchKeyException) NoSuchKeyException.builder().statusCode(404).message("missing").build());

        assertThat(backend.exists(PATH)).isFalse();
    }

    @Test
    void statPrefersTimestampMetadata() {
        Instant stored = Instant.parse("2024-05-01T00:00:00Z");
        when(s3.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder()
                .contentLength(42L)
                .lastModified(stored)
                .metadata(Map.of(ObjectStorageBackend.META_LAST_MODIFIED, "2020-02-02T02:02:02Z"))
                .build());

        FileStat stat = backend.stat(PATH);

        assertThat(stat.size()).isEqualTo(42);
        assertThat(stat.mtime()).isEqualTo(Instant.parse("2020-02-02T02:02:02Z"));
        assertThat(stat.atime()).isEqualTo(stored);
        assertThat(stat.birthtime()).isEqualTo(stored);
        assertThat(stat.directory()).isFalse();
    }

    @Test
    void setTimesReplacesMetadataThroughSelfCopy() {
        when(s3.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder()
                .contentLength(1L)
                .contentType("image/jpeg")
                .metadata(Map.of("owner", "u1"))
                .build());
        Instant atime = Instant.parse("2023-01-01T00:00:00Z");
        Instant mtime = Instant.parse("2022-01-01T00:00:00Z");

        backend.setTimes(PATH, atime, mtime);

        ArgumentCaptor<CopyObjectRequest> copy = ArgumentCaptor.forClass(CopyObjectRequest.class);
        verify(s3).copyObject(copy.capture());
        CopyObjectRequest request = copy.getValue();
        assertThat(request.sourceKey()).isEqualTo(request.destinationKey());
        assertThat(request.metadataDirective()).isEqualTo(MetadataDirective.REPLACE);
        assertThat(request.contentType()).isEqualTo("image/jpeg");
        assertThat(request.metadata())
                .containsEntry("owner", "u1")
                .containsEntry(ObjectStorageBackend.META_LAST_ACCESSED, atime.toString())
                .containsEntry(ObjectStorageBackend.META_LAST_MODIFIED, mtime.toString());
    }

    @Test
    void rangedGetSendsRangeHeader() {
        byte[] slice = "2345".getBytes(StandardCharsets.UTF_8);
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
                GetObjectResponse.builder().contentLength(4L).build(),
                AbortableInputStream.create(new ByteArrayInputStream(slice))));

        byte[] read = backend.getRange(PATH, 2, 4);

        assertThat(read).isEqualTo(slice);
        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3).getObject(request.capture());
        assertThat(request.getValue().range()).isEqualTo("bytes=2-5");
    }

    @Test
    void rangePastEndReturnsNothing() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(416).message("Range Not Satisfiable").build());

        assertThat(backend.getRange(PATH, 100, 4)).isEmpty();
    }

    @Test
    void copyWithoutMetadataKeepsSourceMetadata() {
        RemotePath target = StoragePaths.parse("t3.storage.dev/media/thumbs/a.jpg");

        backend.copy(PATH, target);

        ArgumentCaptor<CopyObjectRequest> copy = ArgumentCaptor.forClass(CopyObjectRequest.class);
        verify(s3).copyObject(copy.capture());
        assertThat(copy.getValue().sourceBucket()).isEqualTo("media");
        assertThat(copy.getValue().destinationKey()).isEqualTo("thumbs/a.jpg");
        assertThat(copy.getValue().metadataDirective()).isNull();
    }
}
