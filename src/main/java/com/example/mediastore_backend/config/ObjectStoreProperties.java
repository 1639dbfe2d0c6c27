package com.example.mediastore_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials per supported object store provider and upload tuning. Values are bound from
 * the provider environment variables in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "storage.object-store")
public class ObjectStoreProperties {
    /** S3 rejects multipart parts below 5 MiB (except the last one). */
    public static final long MIN_PART_SIZE = 5L * 1024 * 1024;

    private Credentials tigris = new Credentials();
    private Credentials wasabi = new Credentials();
    private Credentials aws = new Credentials();
    private long partSizeBytes = 8L * 1024 * 1024;

    public Credentials getTigris() { return tigris; }
    public void setTigris(Credentials tigris) { this.tigris = tigris; }

    public Credentials getWasabi() { return wasabi; }
    public void setWasabi(Credentials wasabi) { this.wasabi = wasabi; }

    public Credentials getAws() { return aws; }
    public void setAws(Credentials aws) { this.aws = aws; }

    public long getPartSizeBytes() { return partSizeBytes; }
    public void setPartSizeBytes(long partSizeBytes) { this.partSizeBytes = partSizeBytes; }

    /** Effective multipart part size, never below the S3 minimum. */
    public long effectivePartSize() {
        return Math.max(MIN_PART_SIZE, partSizeBytes);
    }

    public static class Credentials {
        private String accessKeyId;
        private String secretAccessKey;

        public Credentials() {
        }

        public Credentials(String accessKeyId, String secretAccessKey) {
            this.accessKeyId = accessKeyId;
            this.secretAccessKey = secretAccessKey;
        }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public boolean isComplete() {
            return accessKeyId != null && !accessKeyId.isBlank()
                    && secretAccessKey != null && !secretAccessKey.isBlank();
        }
    }
}
