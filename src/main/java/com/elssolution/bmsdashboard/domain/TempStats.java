package com.elssolution.bmsdashboard.domain;

/** Cell temperature statistics in °C. {@code delta = max - min}. */
public record TempStats(double avg, double min, double max, double delta) {

    public static TempStats union(TempStats left, TempStats right, double avg) {
        double min = Math.min(left.min, right.min);
        double max = Math.max(left.max, right.max);
        return new TempStats(avg, min, max, max - min);
    }
}
