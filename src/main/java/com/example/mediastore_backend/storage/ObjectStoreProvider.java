package com.example.mediastore_backend.storage;

import com.example.mediastore_backend.config.ObjectStoreProperties;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * S3-compatible providers recognised by endpoint host name.
 */
public enum ObjectStoreProvider {
    TIGRIS("Tigris") {
        @Override
        boolean matches(String host) {
            return "fly.storage.tigris.dev".equals(host) || "t3.storage.dev".equals(host);
        }

        @Override
        String region(String host) {
            return "auto";
        }

        @Override
        ObjectStoreProperties.Credentials credentials(ObjectStoreProperties properties) {
            return properties.getTigris();
        }
    },
    WASABI("Wasabi") {
        private final Pattern regionPattern = Pattern.compile("^s3\\.([^.]+)\\.wasabisys\\.com$");

        @Override
        boolean matches(String host) {
            return host.endsWith(".wasabisys.com");
        }

        @Override
        String region(String host) {
            return regionFrom(regionPattern, host);
        }

        @Override
        ObjectStoreProperties.Credentials credentials(ObjectStoreProperties properties) {
            return properties.getWasabi();
        }
    },
    AWS("AWS") {
        private final Pattern regionPattern = Pattern.compile("^s3\\.([^.]+)\\.amazonaws\\.com$");

        @Override
        boolean matches(String host) {
            return host.endsWith(".amazonaws.com");
        }

        @Override
        String region(String host) {
            return regionFrom(regionPattern, host);
        }

        @Override
        ObjectStoreProperties.Credentials credentials(ObjectStoreProperties properties) {
            return properties.getAws();
        }
    };

    static final String DEFAULT_REGION = "us-east-1";

    private final String displayName;

    ObjectStoreProvider(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    abstract boolean matches(String host);

    abstract String region(String host);

    abstract ObjectStoreProperties.Credentials credentials(ObjectStoreProperties properties);

    public static Optional<ObjectStoreProvider> forHost(String host) {
        if (host == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(p -> p.matches(host)).findFirst();
    }

    private static String regionFrom(Pattern pattern, String host) {
        Matcher m = pattern.matcher(host);
        return m.matches() ? m.group(1) : DEFAULT_REGION;
    }
}
