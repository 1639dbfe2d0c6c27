package com.example.mediastore_backend.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/** Body and headers of a GET request. The caller owns and must close the stream. */
public record ObjectContent(InputStream stream, Long length, String contentType, Map<String, String> metadata)
        implements Closeable {

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
