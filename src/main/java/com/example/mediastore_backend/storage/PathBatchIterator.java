package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.exception.StorageException;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Groups a forward-only sequence of paths into lists of {@code take} elements; only the last
 * list may be shorter. Nothing is read ahead beyond the batch being built.
 */
class PathBatchIterator implements Iterator<List<String>> {
    private final Iterator<String> source;
    private final int take;

    PathBatchIterator(Iterator<String> source, int take) {
        if (take <= 0) {
            throw new IllegalArgumentException("take must be positive: " + take);
        }
        this.source = source;
        this.take = take;
    }

    @Override
    public boolean hasNext() {
        try {
            return source.hasNext();
        } catch (UncheckedIOException e) {
            throw new StorageException("Directory walk failed", e.getCause());
        }
    }

    @Override
    public List<String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        List<String> batch = new ArrayList<>(take);
        try {
            while (batch.size() < take && source.hasNext()) {
                batch.add(source.next());
            }
        } catch (UncheckedIOException e) {
            throw new StorageException("Directory walk failed", e.getCause());
        }
        return batch;
    }
}
