package com.example.mediastore_backend.dto;

import com.example.mediastore_backend.storage.DiskUsage;

public record DiskUsageResponse(String mediaLocation, boolean remote, long available, long free, long total) {

    public static DiskUsageResponse of(String mediaLocation, boolean remote, DiskUsage usage) {
        return new DiskUsageResponse(mediaLocation, remote, usage.available(), usage.free(), usage.total());
    }
}
