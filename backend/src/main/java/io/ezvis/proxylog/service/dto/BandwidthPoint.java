package io.ezvis.proxylog.service.dto;

import java.time.Instant;

/**
 * Bytes served in one hour bucket; {@code megabytes} is {@code bytes / 1e6}.
 */
public record BandwidthPoint(Instant bucket, long bytes, double megabytes) {

    public static BandwidthPoint of(Instant bucket, long bytes) {
        return new BandwidthPoint(bucket, bytes, bytes / 1e6);
    }
}
