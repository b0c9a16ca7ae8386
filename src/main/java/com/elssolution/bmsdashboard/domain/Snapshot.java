package com.elssolution.bmsdashboard.domain;

import java.util.Objects;

/**
 * Result of one successful poll cycle. Only built once all three legs
 * decoded; a newer snapshot replaces an older one wholesale.
 */
public record Snapshot(
        MainReading main,
        CellVoltageReport cellVoltage,
        CellTemperatureReport cellTemperature,
        long fetchedAtMs
) {
    public Snapshot {
        Objects.requireNonNull(main, "main");
        Objects.requireNonNull(cellVoltage, "cellVoltage");
        Objects.requireNonNull(cellTemperature, "cellTemperature");
    }
}
