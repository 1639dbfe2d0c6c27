package com.example.mediastore_backend.service;

/**
 * Progress of a single relocation. {@link #CLEANED} and {@link #ABORTED} are terminal.
 */
public enum MoveState {
    IDLE,
    INTENT_RECORDED,
    RELOCATING,
    VERIFYING,
    COMMITTED,
    CLEANED,
    ABORTED
}
