package com.convector.write;

/**
 * Buffered lines are flushed whenever {@code threshold} lines are pending, and
 * on close when {@code flushOnClose} is set.
 */
public record FlushPolicy(int threshold, boolean flushOnClose) {
    public static final FlushPolicy DEFAULT = new FlushPolicy(100, true);

    public FlushPolicy {
        if (threshold < 1) {
            throw new IllegalArgumentException("flush threshold must be >= 1");
        }
    }

    public boolean shouldFlush(int pendingLines) {
        return pendingLines >= threshold;
    }
}
