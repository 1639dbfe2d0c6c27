package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.Person;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PersonRepository extends JpaRepository<Person, UUID> {
}
