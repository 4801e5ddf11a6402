package com.convector.schema;

import java.util.Map;

import com.convector.filter.FilteredRecord;

public interface OutputSchema {
    String name();

    Map<String, Object> apply(FilteredRecord record);
}
