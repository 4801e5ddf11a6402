package com.convector.filter;

import java.util.Map;
import java.util.Optional;

/**
 * Dotted-path lookup into nested maps. A literal top-level key containing dots
 * is used when no nested path resolves.
 */
public final class FieldPaths {
    private FieldPaths() {
    }

    public static Optional<Object> lookup(Map<String, Object> item, String path) {
        Object current = item;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                current = null;
                break;
            }
            current = map.get(segment);
        }
        if (current != null) {
            return Optional.of(current);
        }
        return Optional.ofNullable(item.get(path));
    }
}
