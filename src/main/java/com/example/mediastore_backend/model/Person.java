package com.example.mediastore_backend.model;

import com.example.mediastore_backend.layout.PathOwner;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "person", indexes = @Index(name = "idx_person_owner", columnList = "owner_id"))
public class Person implements PathOwner {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "name", length = 255)
    private String name;

    // face crop
    @Column(name = "thumbnail_path", length = 2048)
    private String thumbnailPath;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Person() {}

    public Person(UUID ownerId, String name) {
        this.ownerId = ownerId;
        this.name = name;
    }

    @Override
    public UUID getId()
    { return id; }
    @Override
    public UUID getOwnerId()
    { return ownerId; }
    public String getName()
    { return name; }
    public void setName(String name)
    { this.name = name; }
    public String getThumbnailPath()
    { return thumbnailPath; }
    public void setThumbnailPath(String thumbnailPath)
    { this.thumbnailPath = thumbnailPath; }
    public Instant getCreatedAt()
    { return createdAt; }
    public long getVersion()
    { return version; }
}
