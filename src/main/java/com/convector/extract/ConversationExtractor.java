package com.convector.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import com.convector.config.Profile;
import com.convector.read.RawRecord;

/**
 * Pairs alternating turns of a {@code data} array into (input, output) records,
 * or completed human/gpt exchanges of a {@code conversations} array. Every record
 * produced from one raw record shares a single conversation id.
 */
public final class ConversationExtractor implements RecordExtractor {
    static final String DATA = "data";
    static final String CONVERSATIONS = "conversations";
    static final String SYSTEM_PROMPT = "system_prompt";

    private final Supplier<String> idGenerator;

    public ConversationExtractor() {
        this(() -> UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    public ConversationExtractor(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public List<NormalizedRecord> extract(RawRecord raw, Profile profile) {
        String conversationId = conversationId(raw);
        if (raw.get(DATA) instanceof List<?> turns) {
            return pairTurns(turns, conversationId);
        }
        if (raw.get(CONVERSATIONS) instanceof List<?> exchanges) {
            return pairExchanges(exchanges, ValueText.of(raw.get(SYSTEM_PROMPT)), raw.containsKey(SYSTEM_PROMPT), conversationId);
        }
        if (!raw.isStructured()) {
            return List.of(new NormalizedRecord("", raw.text(), "", conversationId, Map.of()));
        }
        Map<String, Object> passthrough = new LinkedHashMap<>(raw.fields());
        passthrough.remove(NormalizedRecord.CONVERSATION_ID);
        return List.of(new NormalizedRecord("", "", "", conversationId, passthrough));
    }

    private String conversationId(RawRecord raw) {
        Object existing = raw.get(NormalizedRecord.CONVERSATION_ID);
        if (existing != null && !ValueText.of(existing).isBlank()) {
            return ValueText.of(existing);
        }
        return idGenerator.get();
    }

    private static List<NormalizedRecord> pairTurns(List<?> turns, String conversationId) {
        List<NormalizedRecord> records = new ArrayList<>();
        for (int i = 0; i < turns.size(); i += 2) {
            String input = ValueText.ofTurn(turns.get(i));
            String output = i + 1 < turns.size() ? ValueText.ofTurn(turns.get(i + 1)) : "";
            records.add(new NormalizedRecord("", input, output, conversationId, Map.of()));
        }
        return records;
    }

    private static List<NormalizedRecord> pairExchanges(
            List<?> exchanges,
            String systemPrompt,
            boolean hasSystemPrompt,
            String conversationId) {
        List<NormalizedRecord> records = new ArrayList<>();
        String instruction = systemPrompt;
        String pendingHuman = null;
        for (Object exchange : exchanges) {
            if (!(exchange instanceof Map<?, ?> turn)) {
                continue;
            }
            String speaker = speaker(turn);
            String text = ValueText.ofTurn(turn);
            switch (speaker) {
                case "system" -> {
                    if (!hasSystemPrompt) {
                        instruction = text;
                    }
                }
                case "human", "user" -> pendingHuman = text;
                case "gpt", "assistant" -> {
                    if (pendingHuman != null) {
                        records.add(new NormalizedRecord(instruction, pendingHuman, text, conversationId, Map.of()));
                        pendingHuman = null;
                    }
                }
                default -> {
                }
            }
        }
        return records;
    }

    private static String speaker(Map<?, ?> turn) {
        Object from = turn.containsKey("from") ? turn.get("from") : turn.get("role");
        return from == null ? "" : from.toString().toLowerCase(Locale.ROOT);
    }
}
