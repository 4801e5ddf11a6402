package com.convector.extract;

import java.util.List;

import com.convector.config.Profile;
import com.convector.read.RawRecord;

/**
 * Matches the raw record against a fixed, ordered list of key variants and uses
 * the first one whose input and output keys are both present.
 */
public final class AutoDetectExtractor implements RecordExtractor {
    static final List<KeyVariant> KEY_VARIANTS = List.of(
            new KeyVariant("question", "answer", "instruction"),
            new KeyVariant("Q", "A", "instruction"),
            new KeyVariant("user_message", "bot_message", "instruction"),
            new KeyVariant("user", "bot", "instruction"),
            new KeyVariant("input", "output", "instruction"),
            new KeyVariant("user_query", "bot_reply", "system"));

    @Override
    public List<NormalizedRecord> extract(RawRecord raw, Profile profile) {
        for (KeyVariant variant : KEY_VARIANTS) {
            if (raw.containsKey(variant.input()) && raw.containsKey(variant.output())) {
                return List.of(new NormalizedRecord(
                        ValueText.of(raw.get(variant.instruction())),
                        ValueText.of(raw.get(variant.input())),
                        ValueText.of(raw.get(variant.output())),
                        null,
                        RecordExtractor.additionalFields(raw, profile)));
            }
        }
        return List.of();
    }

    record KeyVariant(String input, String output, String instruction) {
    }
}
