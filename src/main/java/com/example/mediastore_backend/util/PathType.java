package com.example.mediastore_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of tracked file. Decides which field of the owning entity receives a committed path.
 */
public enum PathType {
    ORIGINAL("original"),
    FULL_SIZE("fullsize"),
    PREVIEW("preview"),
    THUMBNAIL("thumbnail"),
    ENCODED_VIDEO("encoded_video"),
    SIDECAR("sidecar"),
    FACE("face");

    private final String value;

    PathType(String value) {
        this.value = value;
    }

    /** Lower-case token used in file names and payloads. */
    public String value() {
        return value;
    }

    /** Generated images stored as asset file rows. */
    public boolean isGeneratedImage() {
        return this == FULL_SIZE || this == PREVIEW || this == THUMBNAIL;
    }

    public boolean isPersonFile() {
        return this == FACE;
    }

    /**
     * Accepts the token ({@code encoded_video}) or the constant name, case-insensitively.
     *
     * @param value incoming value from the request payload.
     * @return matching {@link PathType}.
     */
    @JsonCreator
    public static PathType fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (PathType type : values()) {
            if (type.name().equalsIgnoreCase(normalized) || type.value.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported PathType: " + value);
    }

    @JsonValue
    public String toJson() {
        return name();
    }
}
