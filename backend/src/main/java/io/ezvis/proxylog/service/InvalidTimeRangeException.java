package io.ezvis.proxylog.service;

public class InvalidTimeRangeException extends QueryException {

    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
