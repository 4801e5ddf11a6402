package com.convector.pipeline;

import java.util.List;

public record DirectorySummary(int processedFiles, int skippedFiles, long linesWritten, List<SkippedFile> skipped) {

    public DirectorySummary {
        skipped = List.copyOf(skipped);
    }
}
