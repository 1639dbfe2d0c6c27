package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.Asset;
import com.example.mediastore_backend.model.AssetFile;
import com.example.mediastore_backend.util.PathType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AssetFileRepository extends JpaRepository<AssetFile, UUID> {
    Optional<AssetFile> findByAssetAndType(Asset asset, PathType type);
    Optional<AssetFile> findByAssetIdAndType(UUID assetId, PathType type);
    List<AssetFile> findByAsset(Asset asset);
}
