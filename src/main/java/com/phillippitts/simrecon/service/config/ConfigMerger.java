package com.phillippitts.simrecon.service.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key-wise, last-layer-wins merge of parameter maps.
 */
public final class ConfigMerger {

    private ConfigMerger() {
    }

    /**
     * Merges {@code upper} over {@code lower}.
     *
     * @param lower lower-precedence layer (not modified)
     * @param upper higher-precedence layer (not modified, may be null)
     * @param nullHandling whether null values in {@code upper} clear settings or are skipped
     * @return new, unmodifiable map preserving the lower layer's key order
     */
    public static Map<String, Object> merge(Map<String, Object> lower, Map<String, Object> upper,
                                            NullHandling nullHandling) {
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(nullHandling, "nullHandling");
        Map<String, Object> merged = new LinkedHashMap<>(lower);
        if (upper != null) {
            for (Map.Entry<String, Object> entry : upper.entrySet()) {
                if (isUnsetValue(entry.getValue())) {
                    if (nullHandling == NullHandling.APPLY) {
                        merged.remove(entry.getKey());
                    }
                } else {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Null and empty strings are both "no value".
     */
    static boolean isUnsetValue(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }
}
