package com.elssolution.bmsdashboard.domain;

/** Pack layout as announced by the controller on the cell voltage page. */
public record Topology(
        int slaves,
        int cells,
        int cellsPerSlave,
        int tempSensors,
        int safetyResistors
) {}
