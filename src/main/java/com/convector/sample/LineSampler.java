package com.convector.sample;

import java.io.IOException;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convector.config.Profile;
import com.convector.read.RecordReader;

/**
 * Uniform sample of record positions sized to the line budget, capped at the
 * number of available records.
 */
public class LineSampler implements RecordSampler {
    private static final Logger log = LoggerFactory.getLogger(LineSampler.class);

    @Override
    public Set<Long> select(RecordSource source, Profile profile, Random random) throws IOException {
        long total = 0;
        try (RecordReader reader = source.open()) {
            while (reader.hasNext()) {
                if (reader.next().isOk()) {
                    total++;
                }
            }
        }
        Set<Long> selected = UniformSelection.sample(total, profile.lines(), random);
        log.debug("sample.lines total={} requested={} selected={}", total, profile.lines(), selected.size());
        return selected;
    }
}
