package com.convector.sample;

import java.io.IOException;

import com.convector.read.RecordReader;

/**
 * Opens a fresh reader over the same input on every call.
 */
@FunctionalInterface
public interface RecordSource {
    RecordReader open() throws IOException;
}
