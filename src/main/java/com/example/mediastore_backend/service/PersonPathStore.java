package com.example.mediastore_backend.service;

import com.example.mediastore_backend.model.Person;
import com.example.mediastore_backend.repository.PersonRepository;
import com.example.mediastore_backend.util.PathType;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
public class PersonPathStore implements EntityPathStore {
    private final PersonRepository personRepo;

    public PersonPathStore(PersonRepository personRepo) {
        this.personRepo = personRepo;
    }

    @Override
    public Set<PathType> pathTypes() {
        return Set.of(PathType.FACE);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> currentPath(PathType pathType, UUID entityId) {
        return Optional.ofNullable(load(entityId).getThumbnailPath());
    }

    @Override
    @Transactional
    public void savePath(PathType pathType, UUID entityId, String newPath) {
        load(entityId).setThumbnailPath(newPath);
    }

    private Person load(UUID id) {
        return personRepo.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Person not found: " + id));
    }
}
