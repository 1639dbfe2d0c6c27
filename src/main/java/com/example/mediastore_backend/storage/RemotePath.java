package com.example.mediastore_backend.storage;

/**
 * A remote logical path split into its endpoint host, bucket and object key.
 */
public record RemotePath(String host, String bucket, String key) {

    public boolean sameBucket(RemotePath other) {
        return other != null && host.equals(other.host) && bucket.equals(other.bucket);
    }

    @Override
    public String toString() {
        return host + "/" + bucket + "/" + key;
    }
}
