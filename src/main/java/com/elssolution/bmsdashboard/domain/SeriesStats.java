package com.elssolution.bmsdashboard.domain;

import com.elssolution.bmsdashboard.error.EmptySeriesException;

/**
 * Single-pass min/max/avg/delta over an index range of a sample array.
 * No copies, no boxing.
 */
public final class SeriesStats {

    private SeriesStats() {}

    public static VoltageStats ofMillivolts(int[] samples) throws EmptySeriesException {
        return ofMillivolts(samples, 0, samples.length);
    }

    /** Range is {@code [from, to)}; avg is the truncated integer mean. */
    public static VoltageStats ofMillivolts(int[] samples, int from, int to) throws EmptySeriesException {
        requireRange(samples.length, from, to);
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        long sum = 0;
        for (int i = from; i < to; i++) {
            int v = samples[i];
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        int avg = (int) (sum / (to - from));
        return new VoltageStats(avg, min, max, max - min);
    }

    public static TempStats ofCelsius(double[] samples) throws EmptySeriesException {
        return ofCelsius(samples, 0, samples.length);
    }

    public static TempStats ofCelsius(double[] samples, int from, int to) throws EmptySeriesException {
        requireRange(samples.length, from, to);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            double v = samples[i];
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double avg = sum / (to - from);
        return new TempStats(avg, min, max, max - min);
    }

    /** Truncated integer mean of the whole array. */
    public static int meanMillivolts(int[] samples) throws EmptySeriesException {
        requireRange(samples.length, 0, samples.length);
        long sum = 0;
        for (int v : samples) sum += v;
        return (int) (sum / samples.length);
    }

    public static double meanCelsius(double[] samples) throws EmptySeriesException {
        requireRange(samples.length, 0, samples.length);
        double sum = 0.0;
        for (double v : samples) sum += v;
        return sum / samples.length;
    }

    private static void requireRange(int length, int from, int to) throws EmptySeriesException {
        if (from < 0 || to > length || from > to) {
            throw new IllegalArgumentException("range [" + from + ", " + to + ") outside 0.." + length);
        }
        if (from == to) {
            throw new EmptySeriesException("no samples in range [" + from + ", " + to + ")");
        }
    }
}
