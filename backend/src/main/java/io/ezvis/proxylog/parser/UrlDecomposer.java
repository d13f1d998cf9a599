package io.ezvis.proxylog.parser;

import java.util.Locale;

/**
 * Splits a logged request URL into scheme, host, port, path and query.
 * <p>
 * A URL whose authority cannot be split into a usable host yields {@link UrlParts#EMPTY}; this never
 * invalidates the surrounding log line.
 */
public final class UrlDecomposer {

    private static final String SCHEME_SEPARATOR = "://";

    private UrlDecomposer() {
    }

    public static UrlParts decompose(String url) {
        if (url == null || url.isEmpty()) {
            return UrlParts.EMPTY;
        }
        if (url.startsWith("/")) {
            // origin-form, no authority
            return splitPathAndQuery("", "", 0, url);
        }
        int schemeEnd = url.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd < 0) {
            return UrlParts.EMPTY;
        }
        String scheme = url.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        if (!isValidScheme(scheme)) {
            return UrlParts.EMPTY;
        }

        int authorityStart = schemeEnd + SCHEME_SEPARATOR.length();
        int authorityEnd = indexOfAny(url, authorityStart, '/', '?');
        String authority = url.substring(authorityStart, authorityEnd);

        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        String host;
        String portText;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) {
                return UrlParts.EMPTY;
            }
            host = authority.substring(0, close + 1);
            String rest = authority.substring(close + 1);
            if (!rest.isEmpty() && !rest.startsWith(":")) {
                return UrlParts.EMPTY;
            }
            portText = rest.isEmpty() ? null : rest.substring(1);
        } else {
            int colon = authority.lastIndexOf(':');
            host = colon >= 0 ? authority.substring(0, colon) : authority;
            portText = colon >= 0 ? authority.substring(colon + 1) : null;
            if (!isValidHostName(host)) {
                return UrlParts.EMPTY;
            }
        }

        int port;
        if (portText == null || portText.isEmpty()) {
            port = UrlParts.defaultPort(scheme);
        } else {
            port = parsePort(portText);
            if (port < 0) {
                return UrlParts.EMPTY;
            }
        }

        return splitPathAndQuery(scheme, host.toLowerCase(Locale.ROOT), port, url.substring(authorityEnd));
    }

    private static UrlParts splitPathAndQuery(String scheme, String host, int port, String remainder) {
        int q = remainder.indexOf('?');
        String path = q >= 0 ? remainder.substring(0, q) : remainder;
        String query = q >= 0 ? remainder.substring(q + 1) : "";
        return new UrlParts(scheme, host, port, path, query);
    }

    private static boolean isValidScheme(String scheme) {
        if (scheme.isEmpty() || !Character.isLetter(scheme.charAt(0))) {
            return false;
        }
        for (int i = 1; i < scheme.length(); i++) {
            char c = scheme.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.')) {
                return false;
            }
        }
        return true;
    }

    private static boolean isValidHostName(String host) {
        if (host.isEmpty()) {
            return false;
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_';
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static int parsePort(String text) {
        if (text.length() > 5) {
            return -1;
        }
        int port = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            port = port * 10 + (c - '0');
        }
        return port <= 65535 ? port : -1;
    }

    private static int indexOfAny(String s, int from, char a, char b) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return s.length();
    }
}
