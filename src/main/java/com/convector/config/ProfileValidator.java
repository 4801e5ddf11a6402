package com.convector.config;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProfileValidator {
    private static final Logger log = LoggerFactory.getLogger(ProfileValidator.class);

    private final Set<String> knownSchemas;

    public ProfileValidator(Set<String> knownSchemas) {
        this.knownSchemas = Set.copyOf(knownSchemas);
    }

    public void validate(Profile profile) {
        if (profile == null) {
            throw new ConfigurationException("A profile is required");
        }
        if (!knownSchemas.contains(profile.outputSchema())) {
            throw new ConfigurationException("Unsupported output schema '" + profile.outputSchema()
                    + "', expected one of " + knownSchemas);
        }
        if (profile.lines() != null && profile.lines() < 0) {
            throw new ConfigurationException("lines must be >= 0");
        }
        if (profile.bytes() != null && profile.bytes() < 0) {
            throw new ConfigurationException("bytes must be >= 0");
        }
        if (profile.random() && !profile.hasBudget()) {
            throw new ConfigurationException("Random selection requires a lines or bytes budget");
        }
        boolean onlyOneKey = (profile.inputKey() == null) != (profile.outputKey() == null);
        if (onlyOneKey && !profile.conversational()) {
            log.warn("profile.keys.incomplete input={} output={} fallback=auto-detect",
                    profile.inputKey(),
                    profile.outputKey());
        }
    }
}
