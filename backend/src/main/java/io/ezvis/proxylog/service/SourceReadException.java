package io.ezvis.proxylog.service;

import java.io.IOException;

/**
 * A log source that could not be opened or read.
 */
public class SourceReadException extends RuntimeException {

    public SourceReadException(String source, IOException cause) {
        super("Unable to read " + source + ": " + cause.getMessage(), cause);
    }
}
