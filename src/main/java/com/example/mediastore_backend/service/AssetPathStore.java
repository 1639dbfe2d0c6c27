package com.example.mediastore_backend.service;

import com.example.mediastore_backend.model.Asset;
import com.example.mediastore_backend.model.AssetFile;
import com.example.mediastore_backend.repository.AssetFileRepository;
import com.example.mediastore_backend.repository.AssetRepository;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
public class AssetPathStore implements EntityPathStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(AssetPathStore.class);
    private static final Set<PathType> TYPES = EnumSet.of(
            PathType.ORIGINAL, PathType.FULL_SIZE, PathType.PREVIEW, PathType.THUMBNAIL,
            PathType.ENCODED_VIDEO, PathType.SIDECAR);

    private final AssetRepository assetRepo;
    private final AssetFileRepository assetFileRepo;

    public AssetPathStore(AssetRepository assetRepo, AssetFileRepository assetFileRepo) {
        this.assetRepo = assetRepo;
        this.assetFileRepo = assetFileRepo;
    }

    @Override
    public Set<PathType> pathTypes() {
        return TYPES;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> currentPath(PathType pathType, UUID entityId) {
        if (pathType.isGeneratedImage()) {
            return assetFileRepo.findByAssetIdAndType(entityId, pathType).map(AssetFile::getPath);
        }
        Asset asset = load(entityId);
        return Optional.ofNullable(switch (pathType) {
            case ORIGINAL -> asset.getOriginalPath();
            case ENCODED_VIDEO -> asset.getEncodedVideoPath();
            case SIDECAR -> asset.getSidecarPath();
            default -> throw new IllegalArgumentException("Unsupported path type for assets: " + pathType);
        });
    }

    @Override
    @Transactional
    public void savePath(PathType pathType, UUID entityId, String newPath) {
        Asset asset = load(entityId);
        switch (pathType) {
            case ORIGINAL -> asset.setOriginalPath(newPath);
            case ENCODED_VIDEO -> asset.setEncodedVideoPath(newPath);
            case SIDECAR -> asset.setSidecarPath(newPath);
            case FULL_SIZE, PREVIEW, THUMBNAIL -> upsertFile(asset, pathType, newPath);
            default -> throw new IllegalArgumentException("Unsupported path type for assets: " + pathType);
        }
        LOGGER.debug("Asset path saved asset={} type={} path={}", entityId, pathType, newPath);
    }

    private void upsertFile(Asset asset, PathType type, String path) {
        AssetFile file = assetFileRepo.findByAssetAndType(asset, type)
                .orElseGet(() -> new AssetFile(asset, type, path));
        file.setPath(path);
        assetFileRepo.save(file);
    }

    private Asset load(UUID id) {
        return assetRepo.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Asset not found: " + id));
    }
}
