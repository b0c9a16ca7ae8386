package com.elssolution.bmsdashboard.domain;

import java.util.Arrays;
import java.util.Optional;

/** Cell temperature sensors (°C) in sensor order plus their statistics. */
public final class CellTemperatureReport {

    private final double[] temperatures;
    private final TempStats overall;
    private final TempStats left;   // nullable
    private final TempStats right;  // nullable

    public CellTemperatureReport(double[] temperatures, TempStats overall, TempStats left, TempStats right) {
        if ((left == null) != (right == null)) {
            throw new IllegalArgumentException("left and right must both be present or both absent");
        }
        this.temperatures = temperatures.clone();
        this.overall = overall;
        this.left = left;
        this.right = right;
    }

    public double[] getTemperatures() { return temperatures.clone(); }

    public int getSensorCount() { return temperatures.length; }

    public TempStats getOverall() { return overall; }

    public Optional<TempStats> getLeft() { return Optional.ofNullable(left); }

    public Optional<TempStats> getRight() { return Optional.ofNullable(right); }

    @Override
    public String toString() {
        return "CellTemperatureReport{sensors=" + temperatures.length + ", overall=" + overall
                + ", left=" + left + ", right=" + right + ", °C=" + Arrays.toString(temperatures) + '}';
    }
}
