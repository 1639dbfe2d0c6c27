package com.example.mediastore_backend.dto;

import com.example.mediastore_backend.model.MoveJob;

import java.time.Instant;
import java.util.UUID;

public record MoveJobResponse(
        UUID id,
        UUID entityId,
        String pathType,
        String targetPath,
        String status,
        int attempts,
        String outcome,
        String resultPath,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    public static MoveJobResponse from(MoveJob job) {
        return new MoveJobResponse(
                job.getId(),
                job.getEntityId(),
                job.getPathType().name(),
                job.getTargetPath(),
                job.getStatus().name(),
                job.getAttempts(),
                job.getOutcome(),
                job.getResultPath(),
                job.getLastError(),
                job.getCreatedAt(),
                job.getUpdatedAt());
    }
}
