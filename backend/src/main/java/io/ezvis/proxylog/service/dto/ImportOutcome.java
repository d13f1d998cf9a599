package io.ezvis.proxylog.service.dto;

public enum ImportOutcome {
    /** Source exhausted and every batch flushed. */
    COMPLETED,
    /** A bulk append failed; batches flushed before it stay persisted. */
    STORAGE_FAULT,
    /** The source could not be opened or read to the end. */
    SOURCE_ERROR
}
