package com.example.mediastore_backend.storage;

/** Capacity figures in bytes. */
public record DiskUsage(long available, long free, long total) {
}
