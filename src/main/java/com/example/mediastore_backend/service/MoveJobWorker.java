package com.example.mediastore_backend.service;

import com.example.mediastore_backend.config.StorageProperties;
import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.layout.ImageFormat;
import com.example.mediastore_backend.model.Asset;
import com.example.mediastore_backend.model.MoveJob;
import com.example.mediastore_backend.model.Person;
import com.example.mediastore_backend.repository.AssetRepository;
import com.example.mediastore_backend.repository.PersonRepository;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Drains the move job queue. All relocations run on the single-threaded move executor, so two
 * moves for the same key never overlap.
 */
@Service
public class MoveJobWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(MoveJobWorker.class);

    private final MoveJobService jobService;
    private final MoveCoordinator coordinator;
    private final AssetRepository assetRepo;
    private final PersonRepository personRepo;
    private final Executor moveExecutor;
    private final StorageProperties properties;

    public MoveJobWorker(MoveJobService jobService, MoveCoordinator coordinator, AssetRepository assetRepo,
                         PersonRepository personRepo, @Qualifier("storageMoveExecutor") Executor moveExecutor,
                         StorageProperties properties) {
        this.jobService = jobService;
        this.coordinator = coordinator;
        this.assetRepo = assetRepo;
        this.personRepo = personRepo;
        this.moveExecutor = moveExecutor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reclaimOnStartup() {
        int released = reclaimStale();
        if (released > 0) {
            LOGGER.info("Move worker released stale jobs on startup count={}", released);
        }
    }

    @Scheduled(fixedDelayString = "${storage.move.poll-interval-ms:2000}")
    public void poll() {
        reclaimStale();
        List<MoveJob> jobs = jobService.claimQueuedBatch(properties.getMove().getBatchSize());
        if (jobs.isEmpty()) {
            LOGGER.debug("Move worker poll tick, no jobs claimed");
            return;
        }
        LOGGER.info("Move worker claimed jobs count={} ids={}", jobs.size(), jobs.stream().map(MoveJob::getId).collect(Collectors.toList()));
        jobs.forEach(job -> moveExecutor.execute(() -> runJob(job)));
    }

    private int reclaimStale() {
        Instant cutoff = Instant.now().minusMillis(properties.getMove().getStaleAfterMs());
        return jobService.reclaimStale(cutoff, properties.getMove().getMaxAttempts());
    }

    void runJob(MoveJob job) {
        long t0 = System.nanoTime();
        LOGGER.info("MOVE JOB START job={} entity={} type={} attempt={}", job.getId(), job.getEntityId(), job.getPathType(), job.getAttempts());
        try {
            MoveResult result = execute(job);
            if (result.isSuccess()) {
                jobService.markDone(job.getId(), result);
            } else {
                jobService.markFailed(job.getId(), result.outcome(), "Move aborted: " + result.outcome());
            }
            LOGGER.info("MOVE JOB {} job={} outcome={} in={}ms", result.isSuccess() ? "DONE" : "FAILED",
                    job.getId(), result.outcome(), (System.nanoTime() - t0) / 1_000_000);
        } catch (StorageException e) {
            if (e.getKind().isRetryable() && job.getAttempts() < properties.getMove().getMaxAttempts()) {
                LOGGER.warn("MOVE JOB RETRY job={} attempt={} error={}", job.getId(), job.getAttempts(), e.getMessage());
                jobService.requeue(job.getId(), e.getMessage());
            } else {
                LOGGER.error("MOVE JOB FAILED job={} kind={} error={}", job.getId(), e.getKind(), e.getMessage(), e);
                jobService.markFailed(job.getId(), null, e.getMessage());
            }
        } catch (RuntimeException e) {
            LOGGER.error("MOVE JOB FAILED job={} error={}", job.getId(), e.toString(), e);
            jobService.markFailed(job.getId(), null, e.getMessage());
        }
    }

    private MoveResult execute(MoveJob job) {
        PathType type = job.getPathType();
        String target = job.getTargetPath();
        if (type.isPersonFile()) {
            Person person = personRepo.findById(job.getEntityId())
                    .orElseThrow(() -> new EntityNotFoundException("Person not found: " + job.getEntityId()));
            return target == null ? coordinator.movePersonFile(person) : coordinator.movePersonFile(person, target);
        }

        Asset asset = assetRepo.findById(job.getEntityId())
                .orElseThrow(() -> new EntityNotFoundException("Asset not found: " + job.getEntityId()));
        if (target != null) {
            return coordinator.moveAssetFile(asset, type, target);
        }
        return switch (type) {
            case FULL_SIZE, PREVIEW, THUMBNAIL -> coordinator.moveAssetImage(asset, type, formatFor(type));
            case ENCODED_VIDEO -> coordinator.moveAssetVideo(asset);
            default -> throw new IllegalArgumentException("A target path is required for " + type + " moves");
        };
    }

    private ImageFormat formatFor(PathType type) {
        return switch (type) {
            case FULL_SIZE -> properties.getFullsizeFormat();
            case PREVIEW -> properties.getPreviewFormat();
            default -> properties.getThumbnailFormat();
        };
    }
}
