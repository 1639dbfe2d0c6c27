package com.example.mediastore_backend.repository;

import com.example.mediastore_backend.model.MoveIntent;
import com.example.mediastore_backend.util.PathType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class MoveIntentRepositoryTest {

    @Autowired
    private MoveIntentRepository intentRepository;

    @Test
    void secondIntentForSameKeyViolatesUniqueConstraint() {
        UUID entityId = UUID.randomUUID();
        intentRepository.saveAndFlush(new MoveIntent(entityId, PathType.ORIGINAL, "/a", "/b"));

        assertThrows(DataIntegrityViolationException.class,
                () -> intentRepository.saveAndFlush(new MoveIntent(entityId, PathType.ORIGINAL, "/a", "/c")));
    }

    @Test
    void differentPathTypesOfSameEntityCoexist() {
        UUID entityId = UUID.randomUUID();
        intentRepository.saveAndFlush(new MoveIntent(entityId, PathType.PREVIEW, "/p1", "/p2"));
        intentRepository.saveAndFlush(new MoveIntent(entityId, PathType.THUMBNAIL, "/t1", "/t2"));

        assertThat(intentRepository.findByEntityIdAndPathType(entityId, PathType.THUMBNAIL))
                .get()
                .extracting(MoveIntent::getNewPath)
                .isEqualTo("/t2");
        assertThat(intentRepository.findByEntityIdAndPathType(entityId, PathType.ORIGINAL)).isEmpty();
    }
}
