package com.convector.write;

import java.nio.file.Path;

public record WriteResult(Path outputPath, long linesWritten, long bytesWritten) {
}
