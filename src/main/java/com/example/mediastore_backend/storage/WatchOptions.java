package com.example.mediastore_backend.storage;

/**
 * @param recursive     also watch sub directories, including ones created later
 * @param ignoreInitial do not report files that already exist when the watch starts
 */
public record WatchOptions(boolean recursive, boolean ignoreInitial) {

    public static WatchOptions defaults() {
        return new WatchOptions(true, true);
    }
}
