package com.wshg.catalog.error;

/**
 * Store unavailable or a constraint was violated. The enclosing transaction is rolled back.
 */
public class PersistenceException extends CatalogException {

    public PersistenceException(String message) {
        super(ErrorKind.PERSISTENCE_FAILED, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_FAILED, message, cause);
    }
}
