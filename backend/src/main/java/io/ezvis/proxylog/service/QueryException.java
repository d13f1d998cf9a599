package io.ezvis.proxylog.service;

/**
 * An aggregation query that could not be answered. Never replaced by an empty result.
 */
public class QueryException extends RuntimeException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
