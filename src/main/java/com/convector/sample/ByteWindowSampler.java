package com.convector.sample;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.Profile;
import com.convector.read.RawRecord;
import com.convector.read.ReadResult;
import com.convector.read.RecordReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Accepts consecutive records from the start of the input until their
 * cumulative serialized size would exceed the byte budget. The result is a
 * prefix window, not a uniform sample; {@code random} is not consulted.
 */
public class ByteWindowSampler implements RecordSampler {
    private static final Logger log = LoggerFactory.getLogger(ByteWindowSampler.class);

    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    @Override
    public Set<Long> select(RecordSource source, Profile profile, Random random) throws IOException {
        Set<Long> selected = new TreeSet<>();
        long budget = profile.bytes();
        long used = 0;
        try (RecordReader reader = source.open()) {
            while (reader.hasNext()) {
                ReadResult result = reader.next();
                if (!result.isOk()) {
                    continue;
                }
                long size = sizeOf(result.record());
                if (used + size > budget) {
                    break;
                }
                used += size;
                selected.add(result.record().position());
            }
        }
        log.debug("sample.bytes budget={} used={} selected={}", budget, used, selected.size());
        return selected;
    }

    long sizeOf(RawRecord record) throws IOException {
        String serialized = record.isStructured()
                ? objectMapper.writeValueAsString(record.fields())
                : record.text();
        return serialized.getBytes(StandardCharsets.UTF_8).length + 1L;
    }
}
