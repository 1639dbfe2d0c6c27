package com.example.mediastore_backend.model;

import com.example.mediastore_backend.util.MoveJobStatus;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "move_job",
        indexes = {
                @Index(name = "idx_move_job_status_created", columnList = "status, created_at"),
                @Index(name = "idx_move_job_entity", columnList = "entity_id, path_type")
        }
)
public class MoveJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "path_type", nullable = false, updatable = false, length = 32)
    private PathType pathType;

    // null: canonical location of the path type
    @Column(name = "target_path", length = 2048)
    private String targetPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MoveJobStatus status = MoveJobStatus.QUEUED;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "outcome", length = 64)
    private String outcome;

    @Column(name = "result_path", length = 2048)
    private String resultPath;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected MoveJob() {}

    public MoveJob(UUID entityId, PathType pathType, String targetPath) {
        this.entityId = entityId;
        this.pathType = pathType;
        this.targetPath = targetPath;
    }

    public UUID getId() {
        return id;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public PathType getPathType() {
        return pathType;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public MoveJobStatus getStatus() {
        return status;
    }

    public void setStatus(MoveJobStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getResultPath() {
        return resultPath;
    }

    public void setResultPath(String resultPath) {
        this.resultPath = resultPath;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
