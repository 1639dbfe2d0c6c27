package com.example.mediastore_backend.layout;

public enum ImageFormat {
    JPEG("jpeg"),
    WEBP("webp");

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
