package com.convector.config;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileValidatorTest {
    private final ProfileValidator validator = new ProfileValidator(Set.of("default", "chat_completion"));

    @Test
    void shouldAcceptDefaultProfile() {
        assertDoesNotThrow(() -> validator.validate(new ProfileSettings().toProfile()));
    }

    @Test
    void shouldRejectUnknownOutputSchema() {
        ProfileSettings settings = new ProfileSettings();
        settings.setOutputSchema("alpaca");

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> validator.validate(settings.toProfile()));
        assertTrue(error.getMessage().contains("alpaca"));
    }

    @Test
    void shouldRejectRandomSelectionWithoutBudget() {
        ProfileSettings settings = new ProfileSettings();
        settings.setRandom(true);

        assertThrows(ConfigurationException.class, () -> validator.validate(settings.toProfile()));
    }

    @Test
    void shouldAcceptRandomSelectionWithByteBudget() {
        ProfileSettings settings = new ProfileSettings();
        settings.setRandom(true);
        settings.setBytes(100L);

        assertDoesNotThrow(() -> validator.validate(settings.toProfile()));
    }

    @Test
    void shouldRejectNegativeBudgets() {
        ProfileSettings lines = new ProfileSettings();
        lines.setLines(-1);
        ProfileSettings bytes = new ProfileSettings();
        bytes.setBytes(-5L);

        assertThrows(ConfigurationException.class, () -> validator.validate(lines.toProfile()));
        assertThrows(ConfigurationException.class, () -> validator.validate(bytes.toProfile()));
    }
}
