package org.surveygrid.models;

import java.util.stream.IntStream;

/**
 * Inclusive range of survey years.
 */
public final class YearRange {

    private final int start;
    private final int end;

    public YearRange(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }

    public IntStream years() {
        return IntStream.rangeClosed(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
