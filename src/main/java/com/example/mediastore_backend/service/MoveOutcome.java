package com.example.mediastore_backend.service;

public enum MoveOutcome {
    /** Nothing to move: no old path, or old and new are equal. */
    NOOP,
    MOVED,
    /** Finished a relocation left behind by an earlier, interrupted run. */
    RECOVERED,
    ABORTED_RENAME_FAILED,
    ABORTED_VERIFICATION_FAILED,
    ABORTED_MISSING_FILES,
    ABORTED_MISSING_ASSET_INFO,
    /** Another caller recorded an intent for the same key first. */
    CONCURRENT_MOVE;

    public boolean isSuccess() {
        return this == NOOP || this == MOVED || this == RECOVERED;
    }
}
