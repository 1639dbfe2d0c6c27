package com.example.mediastore_backend.config;

import com.example.mediastore_backend.layout.MediaLocation;
import com.example.mediastore_backend.storage.FileHasher;
import com.example.mediastore_backend.storage.LocalStorageBackend;
import com.example.mediastore_backend.storage.ObjectStorageBackend;
import com.example.mediastore_backend.storage.ObjectStoreClientCache;
import com.example.mediastore_backend.storage.StorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@EnableConfigurationProperties({StorageProperties.class, ObjectStoreProperties.class})
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public MediaLocation mediaLocation(StorageProperties properties) {
        MediaLocation location = MediaLocation.of(properties.getMediaLocation());
        LOGGER.info("Media location: root={} remote={}", location.root(), location.remote());
        return location;
    }

    @Bean(destroyMethod = "close")
    public ObjectStoreClientCache objectStoreClientCache(ObjectStoreProperties properties) {
        return new ObjectStoreClientCache(properties);
    }

    @Bean
    public ObjectStorageBackend objectStorageBackend(ObjectStoreClientCache clients, ObjectStoreProperties properties) {
        return new ObjectStorageBackend(clients, properties);
    }

    @Bean
    public LocalStorageBackend localStorageBackend() {
        return new LocalStorageBackend();
    }

    @Bean
    public StorageGateway storageGateway(LocalStorageBackend local, ObjectStorageBackend remote, StorageProperties properties) {
        var gateway = new StorageGateway(local, remote, properties);
        LOGGER.info("Storage wired: tempDir={}, hashVerification={}, extensions={}",
                properties.getTempDir(), properties.isHashVerificationEnabled(), properties.getSupportedExtensions().size());
        return gateway;
    }

    @Bean
    public FileHasher fileHasher(StorageGateway storage) {
        return new FileHasher(storage);
    }
}
