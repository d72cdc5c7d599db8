package com.wshg.catalog.error;

import java.time.Duration;

/**
 * The caller's deadline passed before the operation committed. Rolled back like any other failure.
 */
public class OperationTimeoutException extends CatalogException {

    public OperationTimeoutException(String operation, Duration overdue) {
        super(ErrorKind.TIMEOUT, operation + " exceeded its deadline by " + overdue.toMillis() + "ms");
        detail("operation", operation);
    }

    public OperationTimeoutException(String operation, Throwable cause) {
        super(ErrorKind.TIMEOUT, operation + " exceeded its deadline", cause);
        detail("operation", operation);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
