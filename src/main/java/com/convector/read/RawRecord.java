package com.convector.read;

import java.util.Collections;
import java.util.Map;

/**
 * A loosely-typed record as produced by a format reader: either a field map
 * (JSON object, CSV row, Parquet row) or an opaque text value.
 */
public record RawRecord(long position, Map<String, Object> fields, String text) {

    public RawRecord {
        fields = fields == null ? null : Collections.unmodifiableMap(fields);
    }

    public static RawRecord ofFields(long position, Map<String, Object> fields) {
        return new RawRecord(position, fields, null);
    }

    public static RawRecord ofText(long position, String text) {
        return new RawRecord(position, null, text);
    }

    public boolean isStructured() {
        return fields != null;
    }

    public boolean containsKey(String key) {
        return fields != null && fields.containsKey(key);
    }

    public Object get(String key) {
        return fields == null ? null : fields.get(key);
    }
}
