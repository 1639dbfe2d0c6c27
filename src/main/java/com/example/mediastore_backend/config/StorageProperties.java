package com.example.mediastore_backend.config;

import com.example.mediastore_backend.layout.ImageFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Media location, verification and relocation settings.
 */
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String mediaLocation = "./data/media";
    private boolean hashVerificationEnabled = true;
    private String tempDir = System.getProperty("java.io.tmpdir");
    private List<String> supportedExtensions = new ArrayList<>(List.of(
            ".jpg", ".jpeg", ".png", ".webp", ".heic", ".heif", ".gif", ".tif", ".tiff", ".avif", ".dng",
            ".mp4", ".mov", ".m4v", ".3gp", ".mkv", ".webm", ".avi", ".mts", ".m2ts"));
    private ImageFormat thumbnailFormat = ImageFormat.WEBP;
    private ImageFormat previewFormat = ImageFormat.JPEG;
    private ImageFormat fullsizeFormat = ImageFormat.JPEG;
    private Move move = new Move();

    public String getMediaLocation() { return mediaLocation; }
    public void setMediaLocation(String mediaLocation) { this.mediaLocation = mediaLocation; }

    public boolean isHashVerificationEnabled() { return hashVerificationEnabled; }
    public void setHashVerificationEnabled(boolean hashVerificationEnabled) { this.hashVerificationEnabled = hashVerificationEnabled; }

    public String getTempDir() { return tempDir; }
    public void setTempDir(String tempDir) { this.tempDir = tempDir; }

    public List<String> getSupportedExtensions() { return supportedExtensions; }
    public void setSupportedExtensions(List<String> supportedExtensions) { this.supportedExtensions = supportedExtensions; }

    public ImageFormat getThumbnailFormat() { return thumbnailFormat; }
    public void setThumbnailFormat(ImageFormat thumbnailFormat) { this.thumbnailFormat = thumbnailFormat; }

    public ImageFormat getPreviewFormat() { return previewFormat; }
    public void setPreviewFormat(ImageFormat previewFormat) { this.previewFormat = previewFormat; }

    public ImageFormat getFullsizeFormat() { return fullsizeFormat; }
    public void setFullsizeFormat(ImageFormat fullsizeFormat) { this.fullsizeFormat = fullsizeFormat; }

    public Move getMove() { return move; }
    public void setMove(Move move) { this.move = move; }

    /**
     * Polling and retry settings of the relocation queue.
     */
    public static class Move {
        private long pollIntervalMs = 2000;
        private int batchSize = 10;
        private int maxAttempts = 3;
        // a RUNNING job not updated for this long is considered orphaned
        private long staleAfterMs = 900_000;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getStaleAfterMs() { return staleAfterMs; }
        public void setStaleAfterMs(long staleAfterMs) { this.staleAfterMs = staleAfterMs; }
    }
}
