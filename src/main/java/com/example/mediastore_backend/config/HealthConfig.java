package com.example.mediastore_backend.config;

import com.example.mediastore_backend.exception.StorageException;
import com.example.mediastore_backend.layout.MediaLocation;
import com.example.mediastore_backend.storage.DiskUsage;
import com.example.mediastore_backend.storage.StorageGateway;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator mediaLocationHealth(StorageGateway storage, MediaLocation location) {
        return () -> {
            if (location.remote()) {
                // nothing to check without touching the network
                return Health.up().withDetail("mediaLocation", location.root()).withDetail("backend", "object-store").build();
            }
            try {
                DiskUsage usage = storage.checkDiskUsage(location.root());
                return Health.up()
                        .withDetail("mediaLocation", location.root())
                        .withDetail("backend", "local")
                        .withDetail("available", usage.available())
                        .withDetail("total", usage.total())
                        .build();
            } catch (StorageException e) {
                return Health.down(e).withDetail("mediaLocation", location.root()).build();
            }
        };
    }
}
