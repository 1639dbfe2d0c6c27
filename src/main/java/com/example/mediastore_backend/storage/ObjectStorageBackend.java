package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.ObjectStoreProperties;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.exception.StorageNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * S3-compatible backend. Wraps Get, Put (single or multipart), Head, Copy and Delete; rename is
 * not a primitive here and is composed by {@link StorageGateway}.
 */
public class ObjectStorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStorageBackend.class);

    /** Custom metadata keys carrying POSIX-like timestamps, ISO-8601 encoded. */
    public static final String META_LAST_MODIFIED = "last-modified";
    public static final String META_LAST_ACCESSED = "last-accessed";

    private final ObjectStoreClientCache clients;
    private final long partSize;

    public ObjectStorageBackend(ObjectStoreClientCache clients, ObjectStoreProperties properties) {
        this.clients = Objects.requireNonNull(clients, "clients");
        this.partSize = properties.effectivePartSize();
    }

    public ObjectContent get(RemotePath path) {
        S3Client client = clients.clientFor(path.host());
        ResponseInputStream<GetObjectResponse> body = call("GET", path, () -> client.getObject(GetObjectRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .build()));
        GetObjectResponse response = body.response();
        return new ObjectContent(body, response.contentLength(), response.contentType(), response.metadata());
    }

    public byte[] getBytes(RemotePath path) {
        try (ObjectContent content = get(path)) {
            return content.stream().readAllBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read object " + path, e);
        }
    }

    /** Ranged GET; returns fewer bytes when the object ends before {@code offset + length}. */
    public byte[] getRange(RemotePath path, long offset, int length) {
        if (length <= 0) {
            return new byte[0];
        }
        S3Client client = clients.clientFor(path.host());
        String range = "bytes=" + offset + "-" + (offset + length - 1);
        try (ResponseInputStream<GetObjectResponse> body = call("GET", path, () -> client.getObject(GetObjectRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .range(range)
                .build()))) {
            return body.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read range " + range + " of " + path, e);
        } catch (StorageException e) {
            // 416: offset at or past the end of the object
            if (e.getCause() instanceof S3Exception s3 && s3.statusCode() == 416) {
                return new byte[0];
            }
            throw e;
        }
    }

    public void put(RemotePath path, byte[] content) {
        S3Client client = clients.clientFor(path.host());
        call("PUT", path, () -> client.putObject(PutObjectRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .contentLength((long) content.length)
                .build(), RequestBody.fromBytes(content)));
    }

    /**
     * Uploads a stream of unknown length. Bodies that fit into one part go out as a single
     * PutObject; larger ones use a multipart upload that is aborted on any failure.
     *
     * @return number of bytes uploaded.
     */
    public long putStream(RemotePath path, InputStream body) {
        S3Client client = clients.clientFor(path.host());
        byte[] buffer = new byte[(int) Math.min(partSize, Integer.MAX_VALUE - 8)];
        int first = readChunk(body, buffer, path);
        if (first < buffer.length) {
            LOGGER.debug("Single PUT for {} ({} bytes)", path, first);
            put(path, Arrays.copyOf(buffer, first));
            return first;
        }

        String uploadId = call("CREATE_MPU", path, () -> client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .build())).uploadId();
        LOGGER.debug("Multipart upload {} started for {}", uploadId, path);
        long total = 0;
        try {
            List<CompletedPart> parts = new ArrayList<>();
            int partNumber = 1;
            int read = first;
            while (read > 0) {
                int number = partNumber;
                byte[] chunk = read == buffer.length ? buffer : Arrays.copyOf(buffer, read);
                UploadPartResponse response = call("UPLOAD_PART", path, () -> client.uploadPart(UploadPartRequest.builder()
                        .bucket(path.bucket())
                        .key(path.key())
                        .uploadId(uploadId)
                        .partNumber(number)
                        .contentLength((long) chunk.length)
                        .build(), RequestBody.fromBytes(chunk)));
                parts.add(CompletedPart.builder().partNumber(number).eTag(response.eTag()).build());
                total += read;
                partNumber++;
                read = readChunk(body, buffer, path);
            }
            call("COMPLETE_MPU", path, () -> client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(path.bucket())
                    .key(path.key())
                    .uploadId(uploadId)
                    .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                    .build()));
            LOGGER.debug("Multipart upload {} complete for {} ({} parts, {} bytes)", uploadId, path, parts.size(), total);
            return total;
        } catch (RuntimeException e) {
            abort(client, path, uploadId);
            throw e;
        }
    }

    public ObjectHead head(RemotePath path) {
        S3Client client = clients.clientFor(path.host());
        HeadObjectResponse response = call("HEAD", path, () -> client.headObject(HeadObjectRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .build()));
        long length = response.contentLength() == null ? 0L : response.contentLength();
        return new ObjectHead(length, response.lastModified(), response.contentType(), response.metadata());
    }

    public boolean exists(RemotePath path) {
        try {
            head(path);
            return true;
        } catch (StorageNotFoundException e) {
            return false;
        }
    }

    public FileStat stat(RemotePath path) {
        ObjectHead head = head(path);
        Instant stored = head.lastModified() != null ? head.lastModified() : Instant.now();
        Instant mtime = timestamp(head.metadata(), META_LAST_MODIFIED, stored);
        Instant atime = timestamp(head.metadata(), META_LAST_ACCESSED, stored);
        return new FileStat(head.length(), mtime, atime, stored, false);
    }

    /**
     * Server-side copy. When {@code replacementMetadata} is non-null the target gets exactly that
     * metadata, otherwise the source metadata is copied along.
     */
    public void copy(RemotePath source, RemotePath target, Map<String, String> replacementMetadata, String contentType) {
        S3Client client = clients.clientFor(target.host());
        CopyObjectRequest.Builder request = CopyObjectRequest.builder()
                .sourceBucket(source.bucket())
                .sourceKey(source.key())
                .destinationBucket(target.bucket())
                .destinationKey(target.key());
        if (replacementMetadata != null) {
            request.metadataDirective(MetadataDirective.REPLACE).metadata(replacementMetadata);
            if (contentType != null) {
                request.contentType(contentType);
            }
        }
        call("COPY", source, () -> client.copyObject(request.build()));
    }

    public void copy(RemotePath source, RemotePath target) {
        copy(source, target, null, null);
    }

    public void delete(RemotePath path) {
        S3Client client = clients.clientFor(path.host());
        call("DELETE", path, () -> client.deleteObject(DeleteObjectRequest.builder()
                .bucket(path.bucket())
                .key(path.key())
                .build()));
    }

    /**
     * Object stores cannot set their own last-modified field, so the timestamps are written to
     * custom metadata through a metadata-replacing self copy.
     */
    public void setTimes(RemotePath path, Instant atime, Instant mtime) {
        ObjectHead head = head(path);
        Map<String, String> metadata = new HashMap<>(head.metadata());
        metadata.put(META_LAST_ACCESSED, atime.toString());
        metadata.put(META_LAST_MODIFIED, mtime.toString());
        copy(path, path, metadata, head.contentType());
    }

    private void abort(S3Client client, RemotePath path, String uploadId) {
        try {
            client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                    .bucket(path.bucket())
                    .key(path.key())
                    .uploadId(uploadId)
                    .build());
            LOGGER.info("Multipart upload {} aborted for {}", uploadId, path);
        } catch (SdkException e) {
            LOGGER.warn("Failed to abort multipart upload {} for {}: {}", uploadId, path, e.getMessage());
        }
    }

    private static int readChunk(InputStream body, byte[] buffer, RemotePath path) {
        try {
            return body.readNBytes(buffer, 0, buffer.length);
        } catch (IOException e) {
            throw new StorageException("Failed to read upload body for " + path, e);
        }
    }

    private static Instant timestamp(Map<String, String> metadata, String key, Instant fallback) {
        String raw = metadata.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            LOGGER.debug("Ignoring unparsable {} metadata value '{}'", key, raw);
            return fallback;
        }
    }

    private static <T> T call(String operation, RemotePath path, Supplier<T> request) {
        try {
            return request.get();
        } catch (NoSuchKeyException e) {
            throw new StorageNotFoundException(operation + " " + path + ": object does not exist", e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new StorageNotFoundException(operation + " " + path + ": object does not exist", e);
            }
            throw new StorageException(operation + " " + path + " failed with status " + e.statusCode() + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException(operation + " " + path + " failed: " + e.getMessage(), e);
        }
    }
}
