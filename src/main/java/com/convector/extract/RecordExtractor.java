package com.convector.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.convector.config.Profile;
import com.convector.read.RawRecord;

/**
 * Converts one raw record into zero or more normalized records. Implementations
 * are pure with respect to {@code (raw, profile)}.
 */
public sealed interface RecordExtractor permits ConversationExtractor, CustomKeysExtractor, AutoDetectExtractor {

    List<NormalizedRecord> extract(RawRecord raw, Profile profile);

    static Map<String, Object> additionalFields(RawRecord raw, Profile profile) {
        Map<String, Object> extra = new LinkedHashMap<>();
        for (String field : profile.additionalFields()) {
            Object value = raw.get(field);
            extra.put(field, value == null ? "" : value);
        }
        return extra;
    }
}
