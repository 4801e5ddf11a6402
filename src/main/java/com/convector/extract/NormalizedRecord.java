package com.convector.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Target training record. {@code conversationId} is only set when the source
 * was conversation-shaped; {@code extra} carries passthrough fields.
 */
public record NormalizedRecord(
        String instruction,
        String input,
        String output,
        String conversationId,
        Map<String, Object> extra) {

    public static final String INSTRUCTION = "instruction";
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String CONVERSATION_ID = "conversation_id";

    public NormalizedRecord {
        instruction = instruction == null ? "" : instruction;
        input = input == null ? "" : input;
        output = output == null ? "" : output;
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public NormalizedRecord(String instruction, String input, String output) {
        this(instruction, input, output, null, Map.of());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(INSTRUCTION, instruction);
        map.put(INPUT, input);
        map.put(OUTPUT, output);
        if (conversationId != null) {
            map.put(CONVERSATION_ID, conversationId);
        }
        extra.forEach(map::putIfAbsent);
        return map;
    }
}
