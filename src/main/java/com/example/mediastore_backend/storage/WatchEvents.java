package com.example.mediastore_backend.storage;

/**
 * Callbacks for {@link StorageGateway#watch}. All methods are optional.
 */
public interface WatchEvents {

    default void onReady() {
    }

    default void onAdd(String path) {
    }

    default void onChange(String path) {
    }

    default void onUnlink(String path) {
    }

    default void onError(Exception error) {
    }
}
