package com.convector.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.convector.config.ConfigurationException;
import com.convector.filter.FilteredRecord;

public class OutputSchemaRegistry {
    private final Map<String, OutputSchema> schemas = new LinkedHashMap<>();

    public OutputSchemaRegistry() {
        register(new DefaultOutputSchema());
        register(new ChatCompletionOutputSchema());
    }

    public OutputSchemaRegistry register(OutputSchema schema) {
        schemas.put(schema.name(), schema);
        return this;
    }

    public Set<String> names() {
        return Set.copyOf(schemas.keySet());
    }

    public OutputSchema resolve(String name) {
        OutputSchema schema = schemas.get(name);
        if (schema == null) {
            throw new ConfigurationException("Unsupported output schema '" + name + "', expected one of " + schemas.keySet());
        }
        return schema;
    }

    public List<Map<String, Object>> apply(List<FilteredRecord> records, String schemaName) {
        OutputSchema schema = resolve(schemaName);
        return records.stream().map(schema::apply).toList();
    }
}
