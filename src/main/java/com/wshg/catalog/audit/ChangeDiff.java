package com.wshg.catalog.audit;

import com.wshg.catalog.model.Resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Field-level difference between two states of a resource, as stored in change records.
 * Each changed field maps to {"old": ..., "new": ...}; data keys are diffed one by one as "data.&lt;key&gt;".
 */
public final class ChangeDiff {

    private static final Set<String> UNTRACKED = Set.of("id", "type", "provider", "data", "createdAt", "updatedAt");

    private ChangeDiff() {
    }

    public static Map<String, Object> between(Resource before, Resource after) {
        Map<String, Object> a = snapshot(before);
        Map<String, Object> b = snapshot(after);
        Map<String, Object> diff = new LinkedHashMap<>();

        Set<String> fields = new TreeSet<>(a.keySet());
        fields.addAll(b.keySet());
        for (String field : fields) {
            if (UNTRACKED.contains(field)) continue;
            put(diff, field, a.get(field), b.get(field));
        }

        Map<String, Object> dataA = asMap(a.get("data"));
        Map<String, Object> dataB = asMap(b.get("data"));
        Set<String> keys = new TreeSet<>(dataA.keySet());
        keys.addAll(dataB.keySet());
        for (String key : keys) {
            put(diff, "data." + key, dataA.get(key), dataB.get(key));
        }
        return diff;
    }

    /**
     * JSON-shaped copy of the resource without its vector.
     */
    public static Map<String, Object> snapshot(Resource resource) {
        return CanonicalJson.toMap(resource);
    }

    private static void put(Map<String, Object> diff, String field, Object oldValue, Object newValue) {
        if (Objects.equals(oldValue, newValue)) return;
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("old", oldValue);
        change.put("new", newValue);
        diff.put(field, change);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
