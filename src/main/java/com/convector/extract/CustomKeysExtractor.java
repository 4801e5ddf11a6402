package com.convector.extract;

import java.util.ArrayList;
import java.util.List;

import com.convector.config.Profile;
import com.convector.read.RawRecord;

public final class CustomKeysExtractor implements RecordExtractor {

    @Override
    public List<NormalizedRecord> extract(RawRecord raw, Profile profile) {
        List<String> missing = new ArrayList<>();
        if (!raw.containsKey(profile.inputKey())) {
            missing.add(profile.inputKey());
        }
        if (!raw.containsKey(profile.outputKey())) {
            missing.add(profile.outputKey());
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException("Record " + raw.position() + " is missing configured key(s) " + missing);
        }
        String instruction = profile.instructionKey() == null ? "" : ValueText.of(raw.get(profile.instructionKey()));
        return List.of(new NormalizedRecord(
                instruction,
                ValueText.of(raw.get(profile.inputKey())),
                ValueText.of(raw.get(profile.outputKey())),
                null,
                RecordExtractor.additionalFields(raw, profile)));
    }
}
