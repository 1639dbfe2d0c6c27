package com.example.mediastore_backend.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open stream over a stored file. {@code length} and {@code type} are {@code null} when unknown.
 */
public record ReadStream(InputStream stream, Long length, String type) implements Closeable {

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
