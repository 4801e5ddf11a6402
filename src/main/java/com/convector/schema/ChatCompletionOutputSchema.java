package com.convector.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.convector.extract.NormalizedRecord;
import com.convector.filter.FilteredRecord;

/**
 * Wraps each record into a {@code messages} array of system, user and assistant
 * turns. The system message is always present; empty user or assistant turns
 * are omitted.
 */
public class ChatCompletionOutputSchema implements OutputSchema {
    public static final String NAME = "chat_completion";
    static final String MESSAGES = "messages";

    private static final Set<String> MESSAGE_FIELDS = Set.of(
            NormalizedRecord.INSTRUCTION,
            NormalizedRecord.INPUT,
            NormalizedRecord.OUTPUT,
            NormalizedRecord.CONVERSATION_ID);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(FilteredRecord filtered) {
        NormalizedRecord record = filtered.record();
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(message("system", record.instruction()));
        if (!record.input().isEmpty()) {
            messages.add(message("user", record.input()));
        }
        if (!record.output().isEmpty()) {
            messages.add(message("assistant", record.output()));
        }

        Map<String, Object> mapped = new LinkedHashMap<>();
        mapped.put(MESSAGES, messages);
        if (record.conversationId() != null) {
            mapped.put(NormalizedRecord.CONVERSATION_ID, record.conversationId());
        }
        Map<String, Object> included = filtered.isReduced() ? filtered.selected() : record.extra();
        included.forEach((key, value) -> {
            if (!MESSAGE_FIELDS.contains(key)) {
                mapped.putIfAbsent(key, value);
            }
        });
        return mapped;
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
