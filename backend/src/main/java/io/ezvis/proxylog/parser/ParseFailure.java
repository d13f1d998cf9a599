package io.ezvis.proxylog.parser;

/**
 * A line that could not be decoded. {@code line} is the input exactly as it was handed to the parser.
 */
public record ParseFailure(String line, ParseFailureReason reason, String detail) {

    @Override
    public String toString() {
        return reason.tag() + ": " + detail;
    }
}
