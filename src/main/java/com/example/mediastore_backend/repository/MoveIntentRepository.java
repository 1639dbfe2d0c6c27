package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.MoveIntent;
import com.example.mediastore_backend.util.PathType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MoveIntentRepository extends JpaRepository<MoveIntent, UUID> {
    Optional<MoveIntent> findByEntityIdAndPathType(UUID entityId, PathType pathType);
}
