package io.ezvis.proxylog.parser;

import java.time.OffsetDateTime;
import java.util.Objects;
import lombok.Builder;

/**
 * One decoded proxy access-log line. The derived URL columns are always a decomposition of {@code url}.
 */
@Builder
public record AccessLogRecord(
        OffsetDateTime timestamp,
        String remoteAddr,
        String identd,
        String userOrSession,
        String method,
        String url,
        String scheme,
        String host,
        int port,
        String path,
        String query,
        String httpVersion,
        int status,
        long bytes,
        String country,
        String userAgent,
        String raw) {

    public AccessLogRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(raw, "raw");
        if (status < 0 || bytes < 0) {
            throw new IllegalArgumentException("status and bytes must be non-negative");
        }
        remoteAddr = nullToEmpty(remoteAddr);
        identd = nullToEmpty(identd);
        userOrSession = nullToEmpty(userOrSession);
        method = nullToEmpty(method);
        url = nullToEmpty(url);
        scheme = nullToEmpty(scheme);
        host = nullToEmpty(host);
        path = nullToEmpty(path);
        query = nullToEmpty(query);
        httpVersion = nullToEmpty(httpVersion);
        country = nullToEmpty(country);
        userAgent = nullToEmpty(userAgent);
    }

    public UrlParts urlParts() {
        return new UrlParts(scheme, host, port, path, query);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
