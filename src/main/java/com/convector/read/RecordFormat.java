package com.convector.read;

import java.io.IOException;
import java.nio.file.Path;

public interface RecordFormat {
    boolean supports(Path path);

    RecordReader open(Path path) throws IOException;
}
