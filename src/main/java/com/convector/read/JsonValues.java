package com.convector.read;

import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

final class JsonValues {
    static final ObjectMapper MAPPER = JsonMapper.builder().build();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonValues() {
    }

    static RawRecord toRawRecord(long position, JsonNode node) {
        if (node.isObject()) {
            return RawRecord.ofFields(position, MAPPER.convertValue(node, MAP_TYPE));
        }
        return RawRecord.ofText(position, node.isTextual() ? node.asText() : node.toString());
    }
}
