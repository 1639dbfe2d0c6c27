package com.example.mediastore_backend.util;

public enum MoveJobStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED
}
