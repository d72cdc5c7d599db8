package com.wshg.catalog.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for catalog operations.
 *
 * <p>Every subclass carries an {@link ErrorKind} and a small map of context details
 * (failing field, broken chain index, ...) so callers can build a message without
 * re-reading internal state.</p>
 */
public class CatalogException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public CatalogException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CatalogException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Whether the same call may succeed if retried unchanged.
     */
    public boolean isRetryable() {
        return false;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    protected void detail(String key, Object value) {
        if (value != null) details.put(key, value);
    }
}
