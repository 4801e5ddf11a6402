package com.convector.extract;

import com.convector.config.Profile;

public final class RecordExtractors {
    private RecordExtractors() {
    }

    public static RecordExtractor forProfile(Profile profile) {
        if (profile.conversational()) {
            return new ConversationExtractor();
        }
        if (profile.hasCustomKeys()) {
            return new CustomKeysExtractor();
        }
        return new AutoDetectExtractor();
    }
}
