package com.convector.sample;

import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

final class UniformSelection {
    private UniformSelection() {
    }

    /**
     * Uniform sample of {@code min(count, total)} distinct indices in
     * {@code [0, total)} without replacement (Floyd's algorithm).
     */
    static Set<Long> sample(long total, long count, Random random) {
        long size = Math.min(Math.max(count, 0), total);
        Set<Long> selected = new TreeSet<>();
        for (long j = total - size; j < total; j++) {
            long candidate = random.nextLong(j + 1);
            if (!selected.add(candidate)) {
                selected.add(j);
            }
        }
        return selected;
    }
}
