package com.convector.filter;

import java.util.Map;

import com.convector.extract.NormalizedRecord;

/**
 * A record that passed the label filter. {@code selected} holds the reduced
 * field view when inclusion directives exist, otherwise it is {@code null}.
 */
public record FilteredRecord(NormalizedRecord record, Map<String, Object> selected) {

    public static FilteredRecord unreduced(NormalizedRecord record) {
        return new FilteredRecord(record, null);
    }

    public boolean isReduced() {
        return selected != null;
    }
}
