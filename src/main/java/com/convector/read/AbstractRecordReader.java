package com.convector.read;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.NoSuchElementException;

abstract class AbstractRecordReader implements RecordReader {
    private ReadResult lookahead;
    private boolean finished;
    private long position;

    /**
     * Returns the next result, or {@code null} once the source is exhausted.
     */
    protected abstract ReadResult computeNext() throws IOException;

    protected long nextPosition() {
        return position++;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            lookahead = computeNext();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (lookahead == null) {
            finished = true;
        }
        return lookahead != null;
    }

    @Override
    public ReadResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ReadResult current = lookahead;
        lookahead = null;
        return current;
    }
}
