package com.example.mediastore_backend.storage;

import java.io.IOException;

/**
 * Work that needs a real file on the local disk, e.g. an external tool reading or writing it.
 */
@FunctionalInterface
public interface LocalFileCallback<T> {

    T apply(String localPath) throws IOException;
}
