package io.ezvis.proxylog.parser;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Decoder for the proxy access-log line format:
 * <pre>
 * remote_addr identd user [dd/Mon/yyyy:HH:mm:ss +zzzz] "METHOD url HTTP/x" status bytes "country" "user agent"
 * </pre>
 * The parser is stateless and never throws for malformed input; every problem is reported as a
 * {@link ParseResult.Failed} carrying a {@link ParseFailureReason}.
 */
@Component
public class AccessLogParser {

    // --- Formats -------------------------------------------------------------------------------

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter
            .ofPattern("dd/MMM/uuuu:HH:mm:ss Z", Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String HTTP_VERSION_PREFIX = "HTTP/";
    private static final int MIN_STATUS = 100;
    private static final int MAX_STATUS = 599;

    // --- Public API ----------------------------------------------------------------------------

    public ParseResult parse(String line) {
        if (line == null || line.isBlank()) {
            return ParseResult.failed(line == null ? "" : line, ParseFailureReason.TRUNCATED_LINE, "empty line");
        }
        Cursor cursor = new Cursor(line);

        String remoteAddr = cursor.nextToken();
        String identd = cursor.nextToken();
        String userOrSession = cursor.nextToken();
        if (userOrSession == null) {
            return truncated(line, "missing client fields");
        }

        // [timestamp]
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            return truncated(line, "missing timestamp");
        }
        if (cursor.peek() != '[') {
            return ParseResult.failed(line, ParseFailureReason.BAD_TIMESTAMP, "expected '[' at column " + cursor.position());
        }
        String timestampText = cursor.delimited(']');
        if (timestampText == null) {
            return truncated(line, "unterminated timestamp");
        }
        OffsetDateTime timestamp = parseTimestamp(timestampText);
        if (timestamp == null) {
            return ParseResult.failed(line, ParseFailureReason.BAD_TIMESTAMP, "unparsable timestamp '" + timestampText + "'");
        }

        // "METHOD URL HTTP/VERSION"
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            return truncated(line, "missing request field");
        }
        if (cursor.peek() != '"') {
            return ParseResult.failed(line, ParseFailureReason.BAD_REQUEST_FIELD, "request field is not quoted");
        }
        String request = cursor.delimited('"');
        if (request == null) {
            return truncated(line, "unterminated request field");
        }
        String[] requestTokens = request.isBlank() ? new String[0] : request.trim().split("\\s+");
        if (requestTokens.length != 3) {
            return ParseResult.failed(line, ParseFailureReason.BAD_REQUEST_FIELD,
                    "request field has " + requestTokens.length + " tokens, expected 3");
        }
        if (!requestTokens[2].startsWith(HTTP_VERSION_PREFIX)) {
            return ParseResult.failed(line, ParseFailureReason.BAD_REQUEST_FIELD,
                    "unexpected protocol '" + requestTokens[2] + "'");
        }

        // status bytes
        String statusText = cursor.nextToken();
        if (statusText == null) {
            return truncated(line, "missing status");
        }
        long status = parseUnsigned(statusText, 3);
        if (status < MIN_STATUS || status > MAX_STATUS) {
            return ParseResult.failed(line, ParseFailureReason.BAD_STATUS, "invalid status '" + statusText + "'");
        }

        String bytesText = cursor.nextToken();
        if (bytesText == null) {
            return truncated(line, "missing bytes");
        }
        long bytes = "-".equals(bytesText) ? 0L : parseUnsigned(bytesText, 18);
        if (bytes < 0) {
            return ParseResult.failed(line, ParseFailureReason.BAD_BYTES, "invalid bytes '" + bytesText + "'");
        }

        String country = readCountry(cursor);
        String userAgent = readUserAgent(cursor);

        String url = requestTokens[1];
        UrlParts parts = UrlDecomposer.decompose(url);

        return ParseResult.parsed(AccessLogRecord.builder()
                .timestamp(timestamp)
                .remoteAddr(remoteAddr)
                .identd(identd)
                .userOrSession(userOrSession)
                .method(requestTokens[0])
                .url(url)
                .scheme(parts.scheme())
                .host(parts.host())
                .port(parts.port())
                .path(parts.path())
                .query(parts.query())
                .httpVersion(requestTokens[2])
                .status((int) status)
                .bytes(bytes)
                .country(country)
                .userAgent(userAgent)
                .raw(line)
                .build());
    }

    // --- Fields --------------------------------------------------------------------------------

    private OffsetDateTime parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text.trim(), LOG_TIMESTAMP).withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Quoted country code ending at its first closing quote; a bare token is accepted too. */
    private String readCountry(Cursor cursor) {
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            return "";
        }
        if (cursor.peek() != '"') {
            return cursor.nextToken();
        }
        String quoted = cursor.delimited('"');
        if (quoted == null) {
            String unterminated = cursor.rest().substring(1).trim();
            cursor.consumeAll();
            return unterminated;
        }
        return quoted.trim();
    }

    /** Remainder of the line with one pair of surrounding quotes removed. */
    private String readUserAgent(Cursor cursor) {
        cursor.skipWhitespace();
        String rest = cursor.rest().stripTrailing();
        cursor.consumeAll();
        if (rest.length() >= 2 && rest.charAt(0) == '"' && rest.charAt(rest.length() - 1) == '"') {
            return rest.substring(1, rest.length() - 1);
        }
        if (rest.startsWith("\"")) {
            return rest.substring(1);
        }
        return rest;
    }

    /** Returns the decimal value, or -1 when the text is not a plain run of at most {@code maxDigits} digits. */
    private static long parseUnsigned(String text, int maxDigits) {
        if (text.isEmpty() || text.length() > maxDigits) {
            return -1;
        }
        long value = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private static ParseResult truncated(String line, String detail) {
        return ParseResult.failed(line, ParseFailureReason.TRUNCATED_LINE, detail);
    }

    // --- Scanner -------------------------------------------------------------------------------

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        int position() {
            return pos;
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        /** Next whitespace-delimited token, or null at end of input. */
        String nextToken() {
            skipWhitespace();
            if (atEnd()) {
                return null;
            }
            int start = pos;
            while (pos < text.length() && !Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            return text.substring(start, pos);
        }

        /**
         * Consumes the opening delimiter under the cursor and everything up to {@code close}.
         * Returns null, without moving, when {@code close} never appears.
         */
        String delimited(char close) {
            int end = text.indexOf(close, pos + 1);
            if (end < 0) {
                return null;
            }
            String value = text.substring(pos + 1, end);
            pos = end + 1;
            return value;
        }

        String rest() {
            return text.substring(pos);
        }

        void consumeAll() {
            pos = text.length();
        }
    }
}
