package com.convector.sample;

import java.io.IOException;
import java.util.Random;
import java.util.Set;

import com.convector.config.Profile;

/**
 * Chooses, before any record is written, the positions of the raw records that
 * the pipeline will process.
 */
public interface RecordSampler {
    Set<Long> select(RecordSource source, Profile profile, Random random) throws IOException;
}
