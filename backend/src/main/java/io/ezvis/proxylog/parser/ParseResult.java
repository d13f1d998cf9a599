package io.ezvis.proxylog.parser;

/**
 * Outcome of decoding one line: either a {@link AccessLogRecord} or a tagged {@link ParseFailure}.
 */
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Failed {

    static ParseResult parsed(AccessLogRecord record) {
        return new Parsed(record);
    }

    static ParseResult failed(String line, ParseFailureReason reason, String detail) {
        return new Failed(new ParseFailure(line, reason, detail));
    }

    default boolean isParsed() {
        return this instanceof Parsed;
    }

    record Parsed(AccessLogRecord record) implements ParseResult {
    }

    record Failed(ParseFailure failure) implements ParseResult {
    }
}
