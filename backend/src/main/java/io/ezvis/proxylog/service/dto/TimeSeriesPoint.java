package io.ezvis.proxylog.service.dto;

import java.time.Instant;

public record TimeSeriesPoint(Instant bucket, long count) {
}
