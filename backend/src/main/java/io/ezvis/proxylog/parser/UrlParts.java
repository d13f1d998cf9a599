package io.ezvis.proxylog.parser;

import java.util.Locale;

public record UrlParts(String scheme, String host, int port, String path, String query) {

    public static final UrlParts EMPTY = new UrlParts("", "", 0, "", "");

    public static int defaultPort(String scheme) {
        return switch (scheme.toLowerCase(Locale.ROOT)) {
            case "http" -> 80;
            case "https" -> 443;
            default -> 0;
        };
    }

    public boolean hasAuthority() {
        return !host.isEmpty();
    }

    /**
     * Re-assembles the URL; the port is omitted when it is the scheme's default.
     */
    public String toUrl() {
        StringBuilder sb = new StringBuilder();
        if (hasAuthority()) {
            sb.append(scheme).append("://");
            sb.append(host);
            if (port != 0 && port != defaultPort(scheme)) {
                sb.append(':').append(port);
            }
        }
        sb.append(path);
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }
}
