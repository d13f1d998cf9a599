package io.ezvis.proxylog.service;

/**
 * One line of an import source. {@code malformed} marks bytes that are not valid UTF-8; {@code text} is then a
 * lossy rendering kept for diagnostics only.
 */
record SourceLine(String text, boolean malformed) {

    static SourceLine decoded(String text) {
        return new SourceLine(text, false);
    }

    static SourceLine undecodable(String text) {
        return new SourceLine(text, true);
    }
}
