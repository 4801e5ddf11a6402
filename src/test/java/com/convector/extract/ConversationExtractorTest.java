package com.convector.extract;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.convector.config.Profile;
import com.convector.config.ProfileSettings;
import com.convector.read.RawRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationExtractorTest {
    private final ConversationExtractor extractor = new ConversationExtractor(() -> "generated-id");
    private final Profile profile = conversational();

    private static Profile conversational() {
        ProfileSettings settings = new ProfileSettings();
        settings.setConversational(true);
        return settings.toProfile();
    }

    @Test
    void shouldPairAlternatingTurnsUnderOneConversationId() {
        RawRecord raw = RawRecord.ofFields(0, Map.of("data", List.of("hi", "hello", "how are you", "fine", "bye")));

        List<NormalizedRecord> records = extractor.extract(raw, profile);

        assertEquals(3, records.size());
        assertEquals("hi", records.get(0).input());
        assertEquals("hello", records.get(0).output());
        assertEquals("how are you", records.get(1).input());
        assertEquals("fine", records.get(1).output());
        assertEquals("bye", records.get(2).input());
        assertEquals("", records.get(2).output());
        assertTrue(records.stream().allMatch(record -> "generated-id".equals(record.conversationId())));
        assertTrue(records.stream().allMatch(record -> record.instruction().isEmpty()));
    }

    @Test
    void shouldReuseExistingConversationId() {
        RawRecord raw = RawRecord.ofFields(0, Map.of("conversation_id", "c-42", "data", List.of("a", "b")));

        List<NormalizedRecord> records = extractor.extract(raw, profile);

        assertEquals(1, records.size());
        assertEquals("c-42", records.get(0).conversationId());
    }

    @Test
    void shouldPairHumanAndGptExchangesWithSystemPrompt() {
        RawRecord raw = RawRecord.ofFields(0, Map.of(
                "system_prompt", "Be brief.",
                "conversations", List.of(
                        Map.of("from", "human", "value", "What is 2+2?"),
                        Map.of("from", "gpt", "value", "4"),
                        Map.of("from", "human", "value", "And 3+3?"),
                        Map.of("from", "gpt", "value", "6"),
                        Map.of("from", "human", "value", "unanswered"))));

        List<NormalizedRecord> records = extractor.extract(raw, profile);

        assertEquals(2, records.size());
        assertEquals(new NormalizedRecord("Be brief.", "What is 2+2?", "4", "generated-id", Map.of()), records.get(0));
        assertEquals(new NormalizedRecord("Be brief.", "And 3+3?", "6", "generated-id", Map.of()), records.get(1));
    }

    @Test
    void shouldTakeInstructionFromSystemRoleTurn() {
        RawRecord raw = RawRecord.ofFields(0, Map.of(
                "conversations", List.of(
                        Map.of("role", "system", "content", "You are terse."),
                        Map.of("role", "user", "content", "Hi"),
                        Map.of("role", "assistant", "content", "Hey"))));

        List<NormalizedRecord> records = extractor.extract(raw, profile);

        assertEquals(1, records.size());
        assertEquals("You are terse.", records.get(0).instruction());
        assertEquals("Hi", records.get(0).input());
        assertEquals("Hey", records.get(0).output());
    }

    @Test
    void shouldTreatTextRecordAsSingleInput() {
        List<NormalizedRecord> records = extractor.extract(RawRecord.ofText(3, "just a line"), profile);

        assertEquals(1, records.size());
        assertEquals("just a line", records.get(0).input());
        assertEquals("", records.get(0).output());
    }

    @Test
    void shouldPassThroughFieldsOfUnrecognizedShape() {
        RawRecord raw = RawRecord.ofFields(0, Map.of("conversation_id", "c1", "topic", "weather"));

        List<NormalizedRecord> records = extractor.extract(raw, profile);

        assertEquals(1, records.size());
        assertEquals("c1", records.get(0).conversationId());
        assertEquals(Map.of("topic", "weather"), records.get(0).extra());
    }
}
