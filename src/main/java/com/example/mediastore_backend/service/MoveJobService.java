package com.example.mediastore_backend.service;

import com.example.mediastore_backend.model.MoveJob;
import com.example.mediastore_backend.repository.MoveJobRepository;
import com.example.mediastore_backend.util.MoveJobStatus;
import com.example.mediastore_backend.util.PathType;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Queue of relocation requests. At most one queued or running job exists per entity and path
 * type; enqueueing again returns the existing job.
 */
@Service
public class MoveJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MoveJobService.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final MoveJobRepository jobRepo;

    public MoveJobService(MoveJobRepository jobRepo) {
        this.jobRepo = jobRepo;
    }

    @Transactional
    public UUID enqueue(UUID entityId, PathType pathType, @Nullable String targetPath) {
        return jobRepo.findActive(entityId, pathType)
                .map(existing -> {
                    LOGGER.debug("MOVE JOB DEDUP entity={} type={} job={}", entityId, pathType, existing.getId());
                    return existing.getId();
                })
                .orElseGet(() -> {
                    MoveJob job = jobRepo.save(new MoveJob(entityId, pathType, targetPath));
                    LOGGER.info("MOVE JOB QUEUED job={} entity={} type={} target={}", job.getId(), entityId, pathType, targetPath);
                    return job.getId();
                });
    }

    @Transactional(readOnly = true)
    public Optional<MoveJob> get(UUID id) {
        return jobRepo.findById(id);
    }

    @Transactional
    public List<MoveJob> claimQueuedBatch(int maxBatchSize) {
        if (maxBatchSize <= 0) {
            return List.of();
        }
        List<MoveJob> jobs = jobRepo.findForUpdateByStatus(MoveJobStatus.QUEUED, PageRequest.of(0, maxBatchSize));
        for (MoveJob job : jobs) {
            job.setStatus(MoveJobStatus.RUNNING);
            job.setAttempts(job.getAttempts() + 1);
        }
        return jobRepo.saveAll(jobs);
    }

    /**
     * Releases RUNNING jobs whose worker went away, typically after a crash mid-move. They go
     * back to the queue, so the next run reaches the coordinator's recovery path, or fail once
     * their attempts are used up.
     *
     * @return number of jobs released
     */
    @Transactional
    public int reclaimStale(Instant cutoff, int maxAttempts) {
        List<MoveJob> stale = jobRepo.findForUpdateByStatusAndUpdatedBefore(MoveJobStatus.RUNNING, cutoff);
        for (MoveJob job : stale) {
            if (job.getAttempts() >= maxAttempts) {
                job.setStatus(MoveJobStatus.FAILED);
                job.setLastError("Abandoned while running after " + job.getAttempts() + " attempts");
                LOGGER.warn("MOVE JOB STALE FAILED job={} entity={} type={} attempts={}",
                        job.getId(), job.getEntityId(), job.getPathType(), job.getAttempts());
            } else {
                job.setStatus(MoveJobStatus.QUEUED);
                LOGGER.warn("MOVE JOB STALE REQUEUED job={} entity={} type={} attempts={}",
                        job.getId(), job.getEntityId(), job.getPathType(), job.getAttempts());
            }
        }
        jobRepo.saveAll(stale);
        return stale.size();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDone(UUID id, MoveResult result) {
        update(id, job -> {
            job.setStatus(MoveJobStatus.DONE);
            job.setOutcome(result.outcome().name());
            job.setResultPath(result.path());
            job.setLastError(null);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID id, @Nullable MoveOutcome outcome, @Nullable String message) {
        update(id, job -> {
            job.setStatus(MoveJobStatus.FAILED);
            job.setOutcome(outcome == null ? null : outcome.name());
            job.setLastError(truncate(message));
        });
    }

    /** Puts a job back in the queue after a transient failure. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void requeue(UUID id, @Nullable String message) {
        update(id, job -> {
            job.setStatus(MoveJobStatus.QUEUED);
            job.setLastError(truncate(message));
        });
    }

    private void update(UUID id, Consumer<MoveJob> change) {
        MoveJob job = jobRepo.findById(id)
                .orElseThrow(() -> new IllegalStateException("Move job not found: " + id));
        change.accept(job);
        jobRepo.save(job);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
