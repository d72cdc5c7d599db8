package com.wshg.catalog.error;

/**
 * Failure categories surfaced by the catalog core.
 */
public enum ErrorKind {
    VALIDATION_FAILED,
    EMBEDDING_FAILED,
    PERSISTENCE_FAILED,
    CHAIN_BROKEN,
    NOT_FOUND,
    TIMEOUT
}
