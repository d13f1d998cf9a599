package io.ezvis.proxylog.repository;

/**
 * Fatal failure of the backing store while creating the schema or appending a batch.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
