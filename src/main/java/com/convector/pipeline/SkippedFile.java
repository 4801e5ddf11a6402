package com.convector.pipeline;

import java.nio.file.Path;

public record SkippedFile(Path path, String reason) {
}
