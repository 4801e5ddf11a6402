package com.convector.pipeline;

import java.nio.file.Path;

public record TransformReport(
        Path inputFile,
        Path outputPath,
        long linesWritten,
        long bytesWritten,
        long recordsRead,
        long malformedRecords,
        long unmappedRecords,
        long filteredRecords) {
}
