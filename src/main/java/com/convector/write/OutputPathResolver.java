package com.convector.write;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.convector.config.Profile;

public final class OutputPathResolver {
    static final String SUFFIX = "_tr.jsonl";

    private OutputPathResolver() {
    }

    /**
     * {@code outputFile} under {@code outputDir} when configured, otherwise
     * {@code <input-stem>_tr.jsonl} under {@code outputDir}. Parent directories
     * are created.
     */
    public static Path resolve(Path inputFile, Profile profile) throws IOException {
        Path output = profile.hasOutputFile()
                ? profile.outputDir().resolve(profile.outputFile())
                : profile.outputDir().resolve(stem(inputFile) + SUFFIX);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        return output;
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
