package com.example.mediastore_backend.storage;

import java.time.Instant;
import java.util.Map;

/** Result of a HEAD request. */
public record ObjectHead(long length, Instant lastModified, String contentType, Map<String, String> metadata) {

    public ObjectHead {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
