package com.wshg.catalog.controller;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.Deadline;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header and query-string helpers shared by the controllers.
 */
final class RequestContext {

    static final String ACTOR_HEADER = "X-Actor";
    static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";

    private RequestContext() {
    }

    /**
     * Caller deadline from the timeout header, or the configured default.
     */
    static Deadline deadline(Long timeoutMs, CatalogProperties props) {
        if (timeoutMs == null) return Deadline.after(props.getOperationTimeout());
        if (timeoutMs <= 0) throw ValidationException.invalidValue(TIMEOUT_HEADER, "timeout must be positive");
        return Deadline.after(Duration.ofMillis(timeoutMs));
    }

    /**
     * Parses repeated {@code tag=key:value} parameters.
     */
    static Map<String, String> tags(List<String> params) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (params == null) return tags;
        for (String p : params) {
            int sep = p.indexOf(':');
            if (sep <= 0) throw ValidationException.invalidValue("tag", "expected key:value, got " + p);
            tags.put(p.substring(0, sep), p.substring(sep + 1));
        }
        return tags;
    }
}
