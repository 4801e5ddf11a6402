package com.convector.sample;

import java.util.Optional;

import com.convector.config.Profile;

public final class RecordSamplers {
    private RecordSamplers() {
    }

    /**
     * Sampler chosen by priority: conversation-grouped, then line, then byte
     * window. Empty when random selection is off or no budget is set.
     */
    public static Optional<RecordSampler> forProfile(Profile profile) {
        if (!profile.random()) {
            return Optional.empty();
        }
        if (profile.conversational() && profile.lines() != null) {
            return Optional.of(new ConversationSampler());
        }
        if (profile.lines() != null) {
            return Optional.of(new LineSampler());
        }
        if (profile.bytes() != null) {
            return Optional.of(new ByteWindowSampler());
        }
        return Optional.empty();
    }
}
