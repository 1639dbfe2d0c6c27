package com.example.mediastore_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MediastoreBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediastoreBackendApplication.class, args);
    }
}
