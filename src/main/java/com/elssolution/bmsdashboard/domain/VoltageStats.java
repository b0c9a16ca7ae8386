package com.elssolution.bmsdashboard.domain;

/** Cell voltage statistics, all in mV. {@code delta = max - min}. */
public record VoltageStats(int avg, int min, int max, int delta) {

    /**
     * Overall group over two partitions. The average is not derivable from the
     * partition averages alone, so the caller passes the whole-array mean.
     */
    public static VoltageStats union(VoltageStats left, VoltageStats right, int avg) {
        int min = Math.min(left.min, right.min);
        int max = Math.max(left.max, right.max);
        return new VoltageStats(avg, min, max, max - min);
    }
}
