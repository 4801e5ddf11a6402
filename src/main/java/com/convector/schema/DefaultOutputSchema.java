package com.convector.schema;

import java.util.LinkedHashMap;
import java.util.Map;

import com.convector.filter.FilteredRecord;

/**
 * Flat {@code instruction/input/output} shape, or the reduced field view when
 * the label filter selected fields.
 */
public class DefaultOutputSchema implements OutputSchema {
    public static final String NAME = "default";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(FilteredRecord record) {
        if (record.isReduced()) {
            return new LinkedHashMap<>(record.selected());
        }
        return record.record().toMap();
    }
}
