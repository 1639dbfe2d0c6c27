package com.example.mediastore_backend.controller;

import com.example.mediastore_backend.dto.DiskUsageResponse;
import com.example.mediastore_backend.dto.MoveJobRequest;
import com.example.mediastore_backend.dto.MoveJobResponse;
import com.example.mediastore_backend.layout.MediaLocation;
import com.example.mediastore_backend.layout.StorageFolder;
import com.example.mediastore_backend.service.MoveCoordinator;
import com.example.mediastore_backend.service.MoveJobService;
import com.example.mediastore_backend.storage.StorageGateway;
import com.example.mediastore_backend.util.PathType;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/v1/storage")
public class StorageController {
    private final StorageGateway storage;
    private final MediaLocation mediaLocation;
    private final MoveJobService moveJobs;
    private final MoveCoordinator coordinator;

    public StorageController(StorageGateway storage, MediaLocation mediaLocation, MoveJobService moveJobs, MoveCoordinator coordinator) {
        this.storage = storage;
        this.mediaLocation = mediaLocation;
        this.moveJobs = moveJobs;
        this.coordinator = coordinator;
    }

    public record EnqueueRes(UUID jobId) {}

    @GetMapping("/usage")
    public DiskUsageResponse usage() {
        return DiskUsageResponse.of(mediaLocation.root(), mediaLocation.remote(), storage.checkDiskUsage(mediaLocation.root()));
    }

    @PostMapping("/moves")
    public ResponseEntity<EnqueueRes> enqueueMove(@Valid @RequestBody MoveJobRequest req) {
        String target = req.targetPath() == null || req.targetPath().isBlank() ? null : req.targetPath().trim();
        if (target == null && (req.pathType() == PathType.ORIGINAL || req.pathType() == PathType.SIDECAR)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TARGET_PATH_REQUIRED");
        }
        UUID id = moveJobs.enqueue(req.entityId(), req.pathType(), target);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EnqueueRes(id));
    }

    @GetMapping("/moves/{id}")
    public MoveJobResponse getMove(@PathVariable UUID id) {
        return moveJobs.get(id)
                .map(MoveJobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "MOVE_JOB_NOT_FOUND"));
    }

    @PostMapping("/folders/{folder}/prune")
    public ResponseEntity<Void> prune(@PathVariable String folder) {
        StorageFolder f;
        try {
            f = StorageFolder.fromValue(folder);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_FOLDER");
        }
        coordinator.removeEmptyDirs(f);
        return ResponseEntity.noContent().build();
    }
}
