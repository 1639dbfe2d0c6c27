package com.example.mediastore_backend.model;

import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a relocation in flight. At most one exists per entity and path type; it is
 * written before the first destructive step and removed only after the new path is committed.
 */
@Entity
@Table(
        name = "move_intent",
        uniqueConstraints = @UniqueConstraint(name = "uq_move_intent_entity_path_type", columnNames = {"entity_id", "path_type"})
)
public class MoveIntent {
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

    @Column(name = "old_path", nullable = false, length = 2048)
    private String oldPath;

    @Column(name = "new_path", nullable = false, length = 2048)
    private String newPath;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected MoveIntent() {}

    public MoveIntent(UUID entityId, PathType pathType, String oldPath, String newPath) {
        this.entityId = entityId;
        this.pathType = pathType;
        this.oldPath = oldPath;
        this.newPath = newPath;
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

    public String getOldPath() {
        return oldPath;
    }

    public void setOldPath(String oldPath) {
        this.oldPath = oldPath;
    }

    public String getNewPath() {
        return newPath;
    }

    public void setNewPath(String newPath) {
        this.newPath = newPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
