package com.example.mediastore_backend.model;

import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A generated image (full size, preview or thumbnail) of an asset.
 */
@Entity
@Table(
        name = "asset_file",
        uniqueConstraints = @UniqueConstraint(name = "uq_asset_file_asset_type", columnNames = {"asset_id", "type"})
)
public class AssetFile {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_id", nullable = false, foreignKey = @ForeignKey(name = "fk_asset_file_asset"))
    private Asset asset;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private PathType type;

    @Column(name = "path", nullable = false, length = 2048)
    private String path;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected AssetFile() {}

    public AssetFile(Asset asset, PathType type, String path) {
        if (!type.isGeneratedImage()) {
            throw new IllegalArgumentException("Not an asset file type: " + type);
        }
        this.asset = asset;
        this.type = type;
        this.path = path;
    }

    public UUID getId()
    { return id; }
    public Asset getAsset()
    { return asset; }
    public PathType getType()
    { return type; }
    public String getPath()
    { return path; }
    public void setPath(String path)
    { this.path = path; }
    public Instant getCreatedAt()
    { return createdAt; }
    public Instant getUpdatedAt()
    { return updatedAt; }
}
