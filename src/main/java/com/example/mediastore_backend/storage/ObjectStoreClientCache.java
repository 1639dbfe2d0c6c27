package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.ObjectStoreProperties;
import com.example.mediastore_backend.exception.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One {@link S3Client} per endpoint host, created on first use and kept for the lifetime of
 * the owning backend. Clients are immutable and shared across threads without locking.
 */
public class ObjectStoreClientCache implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreClientCache.class);

    private final ObjectStoreProperties properties;
    private final Function<ObjectStoreEndpoint, S3Client> clientFactory;
    private final Map<String, S3Client> clients = new ConcurrentHashMap<>();

    public ObjectStoreClientCache(ObjectStoreProperties properties) {
        this(properties, ObjectStoreClientCache::createClient);
    }

    public ObjectStoreClientCache(ObjectStoreProperties properties, Function<ObjectStoreEndpoint, S3Client> clientFactory) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    public S3Client clientFor(String host) {
        return clients.computeIfAbsent(host, h -> {
            ObjectStoreEndpoint endpoint = resolve(h);
            S3Client client = clientFactory.apply(endpoint);
            LOGGER.info("S3 client created for endpoint={} provider={} region={}", h, endpoint.provider(), endpoint.region());
            return client;
        });
    }

    /**
     * Resolves provider, region and credentials for a host.
     *
     * @throws StorageConfigurationException for unknown hosts or missing credentials.
     */
    public ObjectStoreEndpoint resolve(String host) {
        ObjectStoreProvider provider = ObjectStoreProvider.forHost(host)
                .orElseThrow(() -> new StorageConfigurationException(
                        "Unsupported S3 endpoint: " + host + ". Supported providers: Tigris (fly.storage.tigris.dev, t3.storage.dev), "
                                + "Wasabi (*.wasabisys.com), AWS S3 (*.amazonaws.com)"));
        ObjectStoreProperties.Credentials credentials = provider.credentials(properties);
        if (credentials == null || !credentials.isComplete()) {
            throw new StorageConfigurationException(provider.displayName() + " credentials not found for endpoint: " + host
                    + ". Set the access key id and secret access key for this provider.");
        }
        return new ObjectStoreEndpoint(host, provider, provider.region(host),
                credentials.getAccessKeyId(), credentials.getSecretAccessKey());
    }

    int size() {
        return clients.size();
    }

    @Override
    public void close() {
        clients.values().forEach(client -> {
            try {
                client.close();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to close S3 client: {}", e.getMessage());
            }
        });
        clients.clear();
    }

    static S3Client createClient(ObjectStoreEndpoint endpoint) {
        return S3Client.builder()
                .region(Region.of(endpoint.region()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(endpoint.accessKeyId(), endpoint.secretAccessKey())))
                .endpointOverride(URI.create("https://" + endpoint.host()))
                .forcePathStyle(true)
                .build();
    }
}
