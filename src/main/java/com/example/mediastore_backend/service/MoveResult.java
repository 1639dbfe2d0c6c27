package com.example.mediastore_backend.service;

/**
 * @param path the path the owning entity refers to after the call
 */
public record MoveResult(MoveOutcome outcome, MoveState state, String path) {

    static MoveResult noop(String path) {
        return new MoveResult(MoveOutcome.NOOP, MoveState.IDLE, path);
    }

    static MoveResult aborted(MoveOutcome outcome, String path) {
        return new MoveResult(outcome, MoveState.ABORTED, path);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
