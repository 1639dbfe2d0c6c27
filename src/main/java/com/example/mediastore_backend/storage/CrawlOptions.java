package com.example.mediastore_backend.storage;

import java.util.List;

/**
 * Roots to scan for importable files. Exclusion patterns are globs matched against absolute paths.
 */
public record CrawlOptions(List<String> pathsToCrawl, List<String> exclusionPatterns, boolean includeHidden) {

    public CrawlOptions {
        pathsToCrawl = pathsToCrawl == null ? List.of() : List.copyOf(pathsToCrawl);
        exclusionPatterns = exclusionPatterns == null ? List.of() : List.copyOf(exclusionPatterns);
    }
}
