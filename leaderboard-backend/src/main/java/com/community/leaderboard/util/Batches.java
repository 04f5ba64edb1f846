package com.community.leaderboard.util;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits a list into contiguous chunks for bulk writes.
 */
public final class Batches {

    private Batches() {
    }

    /**
     * Lazily partitions {@code items} into consecutive sub-lists of at most {@code batchSize}
     * elements, in the original order. The last chunk may be smaller. Chunks are views of the
     * source list, so the source must not be modified while iterating.
     *
     * @param items     the list to split
     * @param batchSize maximum chunk size, must be positive
     * @return an iterable over the chunks, empty when {@code items} is empty
     */
    public static <T> Iterable<List<T>> partition(List<T> items, int batchSize) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        return () -> new Iterator<>() {
            private int start = 0;

            @Override
            public boolean hasNext() {
                return start < items.size();
            }

            @Override
            public List<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(start + batchSize, items.size());
                List<T> chunk = items.subList(start, end);
                start = end;
                return chunk;
            }
        };
    }

    /**
     * Number of chunks {@link #partition} yields for the given sizes.
     */
    public static int count(int itemCount, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        return (itemCount + batchSize - 1) / batchSize;
    }
}
