package com.convector.extract;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

final class ValueText {
    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private ValueText() {
    }

    static String of(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * Text of a conversation turn: plain values as-is, message objects by their
     * {@code content} or {@code value} field.
     */
    static String ofTurn(Object turn) {
        if (turn instanceof Map<?, ?> message) {
            if (message.containsKey("content")) {
                return of(message.get("content"));
            }
            if (message.containsKey("value")) {
                return of(message.get("value"));
            }
        }
        return of(turn);
    }
}
