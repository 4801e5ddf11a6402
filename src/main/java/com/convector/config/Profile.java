package com.convector.config;

import java.nio.file.Path;
import java.util.List;

import com.convector.filter.FilterCondition;

/**
 * Immutable processing settings shared by every file of a run.
 */
public record Profile(
        boolean conversational,
        String inputKey,
        String outputKey,
        String instructionKey,
        List<String> additionalFields,
        List<FilterCondition> filters,
        Integer lines,
        Long bytes,
        boolean append,
        boolean random,
        Long randomSeed,
        String outputSchema,
        Path outputDir,
        String outputFile) {

    public static final String DEFAULT_SCHEMA = "default";

    public Profile {
        additionalFields = additionalFields == null ? List.of() : List.copyOf(additionalFields);
        filters = filters == null ? List.of() : List.copyOf(filters);
        outputSchema = outputSchema == null || outputSchema.isBlank() ? DEFAULT_SCHEMA : outputSchema;
        outputDir = outputDir == null ? Path.of(".") : outputDir;
    }

    public boolean hasCustomKeys() {
        return isSet(inputKey) && isSet(outputKey);
    }

    public boolean hasBudget() {
        return lines != null || bytes != null;
    }

    public boolean hasOutputFile() {
        return isSet(outputFile);
    }

    public Profile withAppend(boolean appendMode) {
        return new Profile(
                conversational,
                inputKey,
                outputKey,
                instructionKey,
                additionalFields,
                filters,
                lines,
                bytes,
                appendMode,
                random,
                randomSeed,
                outputSchema,
                outputDir,
                outputFile);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
