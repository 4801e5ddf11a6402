package com.convector.read;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of read results for one file.
 * I/O failures surface as {@link java.io.UncheckedIOException}.
 */
public interface RecordReader extends Iterator<ReadResult>, Closeable {
}
