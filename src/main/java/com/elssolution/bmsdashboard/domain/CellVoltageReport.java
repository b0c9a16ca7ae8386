package com.elssolution.bmsdashboard.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Per-cell voltages (mV) in physical cell order plus their statistics.
 * {@code left}/{@code right} are absent when the pack is too small to partition.
 */
public final class CellVoltageReport {

    private final Topology topology;
    private final int[] cellVoltages;
    private final VoltageStats overall;
    private final VoltageStats left;   // nullable
    private final VoltageStats right;  // nullable

    public CellVoltageReport(Topology topology, int[] cellVoltages,
                             VoltageStats overall, VoltageStats left, VoltageStats right) {
        if ((left == null) != (right == null)) {
            throw new IllegalArgumentException("left and right must both be present or both absent");
        }
        this.topology = topology;
        this.cellVoltages = cellVoltages.clone();
        this.overall = overall;
        this.left = left;
        this.right = right;
    }

    public Topology getTopology() { return topology; }

    /** Copy of the cell array; index = physical cell. */
    public int[] getCellVoltages() { return cellVoltages.clone(); }

    public int getCellCount() { return cellVoltages.length; }

    public int getCellVoltage(int index) { return cellVoltages[index]; }

    public VoltageStats getOverall() { return overall; }

    public Optional<VoltageStats> getLeft() { return Optional.ofNullable(left); }

    public Optional<VoltageStats> getRight() { return Optional.ofNullable(right); }

    @Override
    public String toString() {
        return "CellVoltageReport{cells=" + cellVoltages.length + ", overall=" + overall
                + ", left=" + left + ", right=" + right + ", topology=" + topology
                + ", mV=" + Arrays.toString(cellVoltages) + '}';
    }
}
