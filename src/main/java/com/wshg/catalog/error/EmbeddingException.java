package com.wshg.catalog.error;

/**
 * The embedding port could not produce a vector. Aborts the mutation; safe to retry.
 */
public class EmbeddingException extends CatalogException {

    public EmbeddingException(String message) {
        super(ErrorKind.EMBEDDING_FAILED, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING_FAILED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
