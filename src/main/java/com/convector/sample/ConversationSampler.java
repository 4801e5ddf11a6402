package com.convector.sample;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.Profile;
import com.convector.read.RawRecord;
import com.convector.read.ReadResult;
import com.convector.read.RecordReader;

/**
 * Samples whole conversations uniformly without replacement, up to the line
 * budget. A raw record carrying a {@code data} or {@code conversations} array is
 * one conversation; single-message records ({@code role} field) are grouped into
 * conversations that start at each {@code system} message.
 */
public class ConversationSampler implements RecordSampler {
    private static final Logger log = LoggerFactory.getLogger(ConversationSampler.class);

    @Override
    public Set<Long> select(RecordSource source, Profile profile, Random random) throws IOException {
        List<List<Long>> conversations = group(source);
        Set<Long> chosen = UniformSelection.sample(conversations.size(), profile.lines(), random);
        Set<Long> positions = new TreeSet<>();
        for (Long index : chosen) {
            positions.addAll(conversations.get(index.intValue()));
        }
        log.debug("sample.conversations total={} requested={} selected={}",
                conversations.size(),
                profile.lines(),
                chosen.size());
        return positions;
    }

    static List<List<Long>> group(RecordSource source) throws IOException {
        List<List<Long>> conversations = new ArrayList<>();
        List<Long> current = null;
        try (RecordReader reader = source.open()) {
            while (reader.hasNext()) {
                ReadResult result = reader.next();
                if (!result.isOk()) {
                    continue;
                }
                RawRecord record = result.record();
                if (!record.containsKey("role")) {
                    conversations.add(List.of(record.position()));
                    current = null;
                    continue;
                }
                if (current == null || ("system".equals(String.valueOf(record.get("role"))) && !current.isEmpty())) {
                    current = new ArrayList<>();
                    conversations.add(current);
                }
                current.add(record.position());
            }
        }
        return conversations;
    }
}
