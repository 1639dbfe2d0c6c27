package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.Asset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AssetRepository extends JpaRepository<Asset, UUID> {
    List<Asset> findByOwnerId(UUID ownerId);
}
