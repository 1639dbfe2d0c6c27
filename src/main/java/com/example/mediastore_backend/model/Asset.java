package com.example.mediastore_backend.model;

import com.example.mediastore_backend.layout.PathOwner;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "asset", indexes = @Index(name = "idx_asset_owner", columnList = "owner_id"))
public class Asset implements PathOwner {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "original_path", nullable = false, length = 2048)
    private String originalPath;

    @Column(name = "original_file_name", nullable = false, length = 512)
    private String originalFileName;

    @Column(name = "encoded_video_path", length = 2048)
    private String encodedVideoPath;

    @Column(name = "sidecar_path", length = 2048)
    private String sidecarPath;

    @Column(name = "file_size_in_bytes")
    private Long fileSizeInBytes;

    // SHA-1 of the original
    @Column(name = "checksum", length = 20)
    private byte[] checksum;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Asset() {}

    public Asset(UUID ownerId, String originalPath, String originalFileName) {
        this.ownerId = ownerId;
        this.originalPath = originalPath;
        this.originalFileName = originalFileName;
    }

    @Override
    public UUID getId()
    { return id; }
    @Override
    public UUID getOwnerId()
    { return ownerId; }
    public String getOriginalPath()
    { return originalPath; }
    public void setOriginalPath(String originalPath)
    { this.originalPath = originalPath; }
    public String getOriginalFileName()
    { return originalFileName; }
    public void setOriginalFileName(String originalFileName)
    { this.originalFileName = originalFileName; }
    public String getEncodedVideoPath()
    { return encodedVideoPath; }
    public void setEncodedVideoPath(String encodedVideoPath)
    { this.encodedVideoPath = encodedVideoPath; }
    public String getSidecarPath()
    { return sidecarPath; }
    public void setSidecarPath(String sidecarPath)
    { this.sidecarPath = sidecarPath; }
    public Long getFileSizeInBytes()
    { return fileSizeInBytes; }
    public void setFileSizeInBytes(Long fileSizeInBytes)
    { this.fileSizeInBytes = fileSizeInBytes; }
    public byte[] getChecksum()
    { return checksum; }
    public void setChecksum(byte[] checksum)
    { this.checksum = checksum; }
    public Instant getCreatedAt()
    { return createdAt; }
    public Instant getUpdatedAt()
    { return updatedAt; }
    public long getVersion()
    { return version; }
}
