package com.example.mediastore_backend.service;

import com.example.mediastore_backend.config.StorageProperties;
import com.example.mediastore_backend.exception.CrossDeviceException;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.layout.ImageFormat;
import com.example.mediastore_backend.layout.MediaLocation;
import com.example.mediastore_backend.layout.StorageFolder;
import com.example.mediastore_backend.layout.StorageLayout;
import com.example.mediastore_backend.model.Asset;
import com.example.mediastore_backend.model.MoveIntent;
import com.example.mediastore_backend.model.Person;
import com.example.mediastore_backend.repository.MoveIntentRepository;
import com.example.mediastore_backend.storage.FileHasher;
import com.example.mediastore_backend.storage.FileStat;
import com.example.mediastore_backend.storage.StorageGateway;
import com.example.mediastore_backend.util.PathType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Crash-safe relocation of tracked files.
 *
 * <p>An intent row is written before anything destructive happens and removed only after the
 * owning entity points at the new path. A later call for the same entity and path type finds the
 * intent and finishes, or safely abandons, the interrupted move. The source is deleted only once
 * the destination has been verified.
 *
 * <p>Two first-time calls for the same key are not excluded from racing each other; callers
 * serialise relocations per key (see {@link MoveJobWorker}). A racing second insert is detected
 * by the unique constraint and reported as {@link MoveOutcome#CONCURRENT_MOVE}.
 */
@Service
public class MoveCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(MoveCoordinator.class);

    private final StorageGateway storage;
    private final FileHasher hasher;
    private final MoveIntentRepository intentRepo;
    private final Map<PathType, EntityPathStore> pathStores = new EnumMap<>(PathType.class);
    private final MediaLocation mediaLocation;
    private final boolean hashVerificationEnabled;

    public MoveCoordinator(StorageGateway storage, FileHasher hasher, MoveIntentRepository intentRepo,
                           List<EntityPathStore> stores, MediaLocation mediaLocation, StorageProperties properties) {
        this.storage = storage;
        this.hasher = hasher;
        this.intentRepo = intentRepo;
        this.mediaLocation = mediaLocation;
        this.hashVerificationEnabled = properties.isHashVerificationEnabled();
        for (EntityPathStore store : stores) {
            for (PathType type : store.pathTypes()) {
                if (pathStores.putIfAbsent(type, store) != null) {
                    throw new IllegalStateException("More than one path store for " + type);
                }
            }
        }
        for (PathType type : PathType.values()) {
            if (!pathStores.containsKey(type)) {
                throw new IllegalStateException("No path store for " + type);
            }
        }
    }

    // ---- entry points by entity ----

    public MoveResult moveAssetImage(Asset asset, PathType type, ImageFormat format) {
        return moveAssetFile(asset, type, StorageLayout.getImagePath(mediaLocation, asset, type, format));
    }

    public MoveResult moveAssetVideo(Asset asset) {
        return moveAssetFile(asset, PathType.ENCODED_VIDEO, StorageLayout.getEncodedVideoPath(mediaLocation, asset));
    }

    public MoveResult movePersonFile(Person person) {
        return movePersonFile(person, StorageLayout.getPersonThumbnailPath(mediaLocation, person));
    }

    public MoveResult movePersonFile(Person person, String newPath) {
        String oldPath = currentPath(PathType.FACE, person.getId()).orElse(null);
        return moveFile(new MoveRequest(person.getId(), PathType.FACE, oldPath, newPath));
    }

    /**
     * Moves one of the asset's files to {@code newPath}. Originals carry the recorded size and
     * checksum so the destination can be verified against them.
     */
    public MoveResult moveAssetFile(Asset asset, PathType type, String newPath) {
        String oldPath = currentPath(type, asset.getId()).orElse(null);
        MoveRequest.AssetInfo info = null;
        if (type == PathType.ORIGINAL && asset.getFileSizeInBytes() != null) {
            info = new MoveRequest.AssetInfo(asset.getFileSizeInBytes(), asset.getChecksum());
        }
        return moveFile(new MoveRequest(asset.getId(), type, oldPath, newPath, info));
    }

    public void removeEmptyDirs(StorageFolder folder) {
        storage.removeEmptyDirs(StorageLayout.getBaseFolder(mediaLocation, folder), false);
    }

    public Optional<String> currentPath(PathType type, UUID entityId) {
        return pathStores.get(type).currentPath(type, entityId);
    }

    // ---- protocol ----

    public MoveResult moveFile(MoveRequest request) {
        String oldPath = request.oldPath();
        String newPath = request.newPath();
        if (oldPath == null || oldPath.isBlank() || oldPath.equals(newPath)) {
            return MoveResult.noop(oldPath == null || oldPath.isBlank() ? null : oldPath);
        }
        if (request.pathType() == PathType.ORIGINAL && request.assetInfo() == null) {
            LOGGER.warn("MOVE ABORT entity={} type={} reason=missing-asset-info", request.entityId(), request.pathType());
            return MoveResult.aborted(MoveOutcome.ABORTED_MISSING_ASSET_INFO, oldPath);
        }

        Optional<MoveIntent> existing = intentRepo.findByEntityIdAndPathType(request.entityId(), request.pathType());
        if (existing.isEmpty() && newPath.equals(currentPath(request.pathType(), request.entityId()).orElse(null))) {
            // an earlier call already committed this move
            LOGGER.debug("MOVE NOOP entity={} type={} already at {}", request.entityId(), request.pathType(), newPath);
            return MoveResult.noop(newPath);
        }

        storage.ensureParentFolder(newPath);

        boolean recovered = false;
        MoveIntent intent;
        if (existing.isPresent()) {
            intent = existing.get();
            LOGGER.info("MOVE RECOVER entity={} type={} old={} new={}", request.entityId(), request.pathType(),
                    intent.getOldPath(), intent.getNewPath());
            boolean oldExists = storage.checkFileExists(intent.getOldPath());
            boolean newExists = storage.checkFileExists(intent.getNewPath());
            String source;
            if (oldExists) {
                // new may be a partial copy from the interrupted run; old stays authoritative
                source = intent.getOldPath();
            } else if (newExists) {
                source = intent.getNewPath();
                if (!verifyRecovered(source, request.assetInfo())) {
                    LOGGER.error("MOVE FATAL entity={} type={} old file is missing and new file {} does not match what was expected",
                            request.entityId(), request.pathType(), source);
                    return MoveResult.aborted(MoveOutcome.ABORTED_VERIFICATION_FAILED, oldPath);
                }
                recovered = true;
            } else {
                LOGGER.error("MOVE FATAL entity={} type={} file exists at neither {} nor {}",
                        request.entityId(), request.pathType(), intent.getOldPath(), intent.getNewPath());
                return MoveResult.aborted(MoveOutcome.ABORTED_MISSING_FILES, oldPath);
            }
            LOGGER.info("MOVE RECOVER entity={} found file at {} location", request.entityId(), recovered ? "new" : "old");
            intent.setOldPath(source);
            intent.setNewPath(newPath);
            intent = intentRepo.save(intent);
        } else {
            try {
                intent = intentRepo.saveAndFlush(new MoveIntent(request.entityId(), request.pathType(), oldPath, newPath));
            } catch (DataIntegrityViolationException e) {
                LOGGER.warn("MOVE ABORT entity={} type={} reason=concurrent-move", request.entityId(), request.pathType());
                return MoveResult.aborted(MoveOutcome.CONCURRENT_MOVE, oldPath);
            }
        }
        LOGGER.info("MOVE START entity={} type={} old={} new={}", request.entityId(), request.pathType(), intent.getOldPath(), newPath);

        String source = intent.getOldPath();
        if (!source.equals(newPath)) {
            Optional<MoveResult> aborted = relocate(request, source, newPath);
            if (aborted.isPresent()) {
                return aborted.get();
            }
        }

        pathStores.get(request.pathType()).savePath(request.pathType(), request.entityId(), newPath);
        MoveState state = MoveState.COMMITTED;
        try {
            intentRepo.delete(intent);
            state = MoveState.CLEANED;
        } catch (DataAccessException e) {
            // the next call for this key finds the file at new and finishes the cleanup
            LOGGER.warn("MOVE CLEANUP FAILED entity={} type={} intent={} error={}",
                    request.entityId(), request.pathType(), intent.getId(), e.getMessage());
        }
        MoveOutcome outcome = recovered ? MoveOutcome.RECOVERED : MoveOutcome.MOVED;
        LOGGER.info("MOVE {} entity={} type={} path={}", outcome, request.entityId(), request.pathType(), newPath);
        return new MoveResult(outcome, state, newPath);
    }

    /**
     * Rename, or copy, verify and delete when the rename crosses devices.
     *
     * @return the abort result, empty when the file now lives at {@code newPath}.
     */
    private Optional<MoveResult> relocate(MoveRequest request, String source, String newPath) {
        try {
            LOGGER.debug("Attempting to rename file: {} => {}", source, newPath);
            storage.rename(source, newPath);
            return Optional.empty();
        } catch (CrossDeviceException e) {
            LOGGER.debug("Unable to rename file across devices, falling back to copy, verify and delete: {}", e.getMessage());
        } catch (StorageException e) {
            LOGGER.warn("MOVE ABORT entity={} type={} reason=rename-failed kind={} error={}",
                    request.entityId(), request.pathType(), e.getKind(), e.getMessage());
            return Optional.of(MoveResult.aborted(MoveOutcome.ABORTED_RENAME_FAILED, request.oldPath()));
        }

        storage.copyFile(source, newPath);

        if (!verify(source, newPath, request.assetInfo())) {
            storage.unlink(newPath);
            LOGGER.warn("MOVE ABORT entity={} type={} reason=verification-failed", request.entityId(), request.pathType());
            return Optional.of(MoveResult.aborted(MoveOutcome.ABORTED_VERIFICATION_FAILED, request.oldPath()));
        }

        try {
            FileStat stat = storage.stat(source);
            storage.utimes(newPath, stat.atime(), stat.mtime());
        } catch (StorageException e) {
            LOGGER.warn("Unable to copy timestamps to {}: {}", newPath, e.getMessage());
        }

        try {
            storage.unlink(source);
        } catch (StorageException e) {
            LOGGER.warn("Unable to delete old file {}, it is no longer tracked: {}", source, e.getMessage());
        }
        return Optional.empty();
    }

    private boolean verify(String source, String destination, MoveRequest.AssetInfo info) {
        long expected = info != null ? info.sizeInBytes() : storage.stat(source).size();
        return matches(destination, expected, info);
    }

    /**
     * The old file is gone, so there is nothing to compare with but the recorded asset info. Sources
     * are only deleted after a successful verification, so without asset info the new file is
     * the verified copy.
     */
    private boolean verifyRecovered(String destination, MoveRequest.AssetInfo info) {
        if (info == null) {
            return true;
        }
        return matches(destination, info.sizeInBytes(), info);
    }

    private boolean matches(String destination, long expectedSize, MoveRequest.AssetInfo info) {
        long actualSize = storage.stat(destination).size();
        LOGGER.debug("File size check: {} === {}", actualSize, expectedSize);
        if (actualSize != expectedSize) {
            LOGGER.warn("Unable to complete move. File size mismatch: {} !== {}", actualSize, expectedSize);
            return false;
        }
        if (hashVerificationEnabled && info != null && info.checksum() != null) {
            byte[] actual = hasher.sha1(destination);
            if (!Arrays.equals(actual, info.checksum())) {
                LOGGER.warn("Unable to complete move. File checksum mismatch: {} !== {}",
                        base64(actual), base64(info.checksum()));
                return false;
            }
            LOGGER.debug("File checksum check: {} === {}", base64(actual), base64(info.checksum()));
        }
        return true;
    }

    private static String base64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
