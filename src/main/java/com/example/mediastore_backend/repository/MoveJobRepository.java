package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.MoveJob;
import com.example.mediastore_backend.util.MoveJobStatus;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MoveJobRepository extends JpaRepository<MoveJob, UUID> {
    long countByStatus(MoveJobStatus status);

    // lock timeout -2 = SKIP LOCKED where the dialect supports it
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("select j from MoveJob j where j.status = :status order by j.createdAt")
    List<MoveJob> findForUpdateByStatus(@Param("status") MoveJobStatus status, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("select j from MoveJob j where j.status = :status and j.updatedAt < :cutoff order by j.updatedAt")
    List<MoveJob> findForUpdateByStatusAndUpdatedBefore(@Param("status") MoveJobStatus status,
                                                       @Param("cutoff") Instant cutoff);

    @Query("""
       select j from MoveJob j
       where j.entityId = :entityId
         and j.pathType = :pathType
         and j.status in :statuses
       order by j.createdAt desc
    """)
    List<MoveJob> findByKeyAndStatusIn(@Param("entityId") UUID entityId,
                                       @Param("pathType") PathType pathType,
                                       @Param("statuses") Collection<MoveJobStatus> statuses);

    default Optional<MoveJob> findActive(UUID entityId, PathType pathType) {
        return findByKeyAndStatusIn(entityId, pathType, List.of(MoveJobStatus.QUEUED, MoveJobStatus.RUNNING))
                .stream()
                .findFirst();
    }
}
