package com.example.mediastore_backend.storage;

import java.util.List;

/**
 * Same as {@link CrawlOptions} plus the number of paths per emitted batch.
 */
public record WalkOptions(List<String> pathsToCrawl, List<String> exclusionPatterns, boolean includeHidden, int take) {

    public WalkOptions {
        pathsToCrawl = pathsToCrawl == null ? List.of() : List.copyOf(pathsToCrawl);
        exclusionPatterns = exclusionPatterns == null ? List.of() : List.copyOf(exclusionPatterns);
        if (take <= 0) {
            throw new IllegalArgumentException("take must be positive: " + take);
        }
    }

    CrawlOptions asCrawlOptions() {
        return new CrawlOptions(pathsToCrawl, exclusionPatterns, includeHidden);
    }
}
