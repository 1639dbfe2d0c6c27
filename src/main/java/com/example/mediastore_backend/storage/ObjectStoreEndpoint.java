package com.example.mediastore_backend.storage;

/**
 * Everything needed to build a client for one endpoint host.
 */
public record ObjectStoreEndpoint(String host, ObjectStoreProvider provider, String region,
                                  String accessKeyId, String secretAccessKey) {

    @Override
    public String toString() {
        // keep secrets out of logs
        return "ObjectStoreEndpoint[host=" + host + ", provider=" + provider + ", region=" + region + "]";
    }
}
