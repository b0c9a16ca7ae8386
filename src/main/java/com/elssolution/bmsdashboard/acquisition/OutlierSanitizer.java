package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.SeriesStats;
import com.elssolution.bmsdashboard.domain.TempStats;
import com.elssolution.bmsdashboard.domain.VoltageStats;
import com.elssolution.bmsdashboard.error.EmptySeriesException;

/**
 * Display-safety filter for sensor glitches (saturated or zeroed taps).
 * Not a measurement correction: the operator can switch it off to see raw values.
 *
 * Arrays are modified in place; order and length never change.
 */
public final class OutlierSanitizer {

    private OutlierSanitizer() {}

    /**
     * Replaces every sample outside {@code fence} with the truncated mean of the
     * raw array (taken before any replacement).
     *
     * @return the raw mean used as replacement
     */
    public static int sanitizeMillivolts(int[] samples, Fence fence) throws EmptySeriesException {
        int avg = SeriesStats.meanMillivolts(samples);
        for (int i = 0; i < samples.length; i++) {
            if (!fence.contains(samples[i])) samples[i] = avg;
        }
        return avg;
    }

    public static double sanitizeCelsius(double[] samples, Fence fence) throws EmptySeriesException {
        double avg = SeriesStats.meanCelsius(samples);
        for (int i = 0; i < samples.length; i++) {
            if (!fence.contains(samples[i])) samples[i] = avg;
        }
        return avg;
    }

    /**
     * Recomputes min/max of {@code [from, to)} through the stricter report fence.
     * A bound with no qualifying sample keeps its plain value; if the filtered
     * bounds cross, the plain stats are returned unchanged.
     */
    public static VoltageStats applyReportFence(VoltageStats stats, int[] samples, int from, int to,
                                                ReportFence report) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int i = from; i < to; i++) {
            int v = samples[i];
            if (report.minCandidate(v) && v < min) min = v;
            if (report.maxCandidate(v) && v > max) max = v;
        }
        if (min == Integer.MAX_VALUE) min = stats.min();
        if (max == Integer.MIN_VALUE) max = stats.max();
        if (min > max) return stats;
        return new VoltageStats(stats.avg(), min, max, max - min);
    }

    public static TempStats applyReportFence(TempStats stats, double[] samples, int from, int to,
                                             ReportFence report) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = samples[i];
            if (report.minCandidate(v) && v < min) min = v;
            if (report.maxCandidate(v) && v > max) max = v;
        }
        if (min == Double.POSITIVE_INFINITY) min = stats.min();
        if (max == Double.NEGATIVE_INFINITY) max = stats.max();
        if (min > max) return stats;
        return new TempStats(stats.avg(), min, max, max - min);
    }
}
