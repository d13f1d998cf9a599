package io.ezvis.proxylog.parser;

public enum ParseFailureReason {
    BAD_TIMESTAMP("bad-timestamp"),
    BAD_REQUEST_FIELD("bad-request-field"),
    BAD_STATUS("bad-status"),
    BAD_BYTES("bad-bytes"),
    TRUNCATED_LINE("truncated-line"),
    BAD_ENCODING("bad-encoding");

    private final String tag;

    ParseFailureReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
