package com.example.mediastore_backend.service;

import com.example.mediastore_backend.storage.FileStat;
import com.example.mediastore_backend.storage.ReadStream;
import com.example.mediastore_backend.storage.StorageGateway;
import com.example.mediastore_backend.storage.StoragePaths;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.*;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Streams tracked files from whichever backend holds them, with byte-range support.
 */
@Service
public class FileService {
    private final StorageGateway storage;
    private final MoveCoordinator coordinator;

    public FileService(StorageGateway storage, MoveCoordinator coordinator) {
        this.storage = storage;
        this.coordinator = coordinator;
    }

    public ResponseEntity<Resource> stream(UUID entityId, PathType type, @Nullable String rangeHeader,
                                           @Nullable String ifNoneMatch, boolean download) throws IOException {
        String path;
        try {
            path = coordinator.currentPath(type, entityId)
                    .orElseThrow(() -> notFound(entityId, type));
        } catch (EntityNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }

        FileStat stat = storage.stat(path);
        long length = stat.size();
        long lastMod = stat.mtime().toEpochMilli();
        String etag = "\"" + lastMod + "-" + length + "\"";
        String fn = StoragePaths.basename(path);
        MediaType contentType = guessType(fn);
        String cd = (download ? "attachment" : "inline") + "; filename=\"" + fn + "\"; filename*=UTF-8''"
                + URLEncoder.encode(fn, StandardCharsets.UTF_8);
        CacheControl cacheCtl = CacheControl.maxAge(365, TimeUnit.DAYS).cachePublic().immutable();

        if ((rangeHeader == null || rangeHeader.isBlank()) && ifNoneMatch != null && ifNoneMatch.contains(etag)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                    .eTag(etag)
                    .lastModified(lastMod)
                    .cacheControl(cacheCtl)
                    .build();
        }

        ReadStream file = storage.createReadStream(path, contentType.toString());
        if (rangeHeader == null || rangeHeader.isBlank()) {
            return ResponseEntity.ok()
                    .cacheControl(cacheCtl).eTag(etag).lastModified(lastMod)
                    .contentType(contentType)
                    .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                    .header(HttpHeaders.CONTENT_DISPOSITION, cd)
                    .contentLength(length)
                    .body(resource(file.stream(), length, fn));
        }

        HttpRange r = HttpRange.parseRanges(rangeHeader).get(0);
        long start = r.getRangeStart(length);
        long end = r.getRangeEnd(length);
        if (start >= length) {
            file.close();
            return ResponseEntity.status(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE)
                    .header(HttpHeaders.CONTENT_RANGE, "bytes */" + length).build();
        }
        long rangeLen = end - start + 1;
        InputStream is = file.stream();
        try {
            is.skipNBytes(start);
        } catch (IOException | RuntimeException e) {
            // the file may have shrunk since stat
            file.close();
            throw e;
        }

        return ResponseEntity.status(HttpStatus.PARTIAL_CONTENT)
                .cacheControl(cacheCtl).eTag(etag).lastModified(lastMod)
                .contentType(contentType)
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .header(HttpHeaders.CONTENT_RANGE, "bytes " + start + "-" + end + "/" + length)
                .header(HttpHeaders.CONTENT_DISPOSITION, cd)
                .contentLength(rangeLen)
                .body(resource(is, rangeLen, fn));
    }

    private static Resource resource(InputStream is, long length, String filename) {
        return new InputStreamResource(is) {
            @Override public long contentLength() { return length; }
            @Override public String getFilename() { return filename; }
        };
    }

    private static ResponseStatusException notFound(UUID entityId, PathType type) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "No " + type.value() + " file for " + entityId);
    }

    static MediaType guessType(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".mp4") || name.endsWith(".m4v")) return MediaType.parseMediaType("video/mp4");
        if (name.endsWith(".mov")) return MediaType.parseMediaType("video/quicktime");
        if (name.endsWith(".webm")) return MediaType.parseMediaType("video/webm");
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) return MediaType.IMAGE_JPEG;
        if (name.endsWith(".png")) return MediaType.IMAGE_PNG;
        if (name.endsWith(".gif")) return MediaType.IMAGE_GIF;
        if (name.endsWith(".webp")) return MediaType.parseMediaType("image/webp");
        if (name.endsWith(".heic")) return MediaType.parseMediaType("image/heic");
        if (name.endsWith(".xmp")) return MediaType.parseMediaType("application/rdf+xml");
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
