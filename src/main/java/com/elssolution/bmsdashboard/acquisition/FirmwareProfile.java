package com.elssolution.bmsdashboard.acquisition;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.elssolution.bmsdashboard.acquisition.FieldSpec.decimal;
import static com.elssolution.bmsdashboard.acquisition.FieldSpec.integer;

/**
 * Wire layout of one controller firmware: page names, keys, positional decode
 * plans and partition rules. New firmware revisions get a new profile, not new code.
 */
public record FirmwareProfile(
        String name,
        String mainResource,
        DecodePlan mainPlan,
        String cellVoltageResource,
        DecodePlan topologyPlan,
        SeriesPlan cellVoltagePlan,
        Partition cellVoltagePartition,
        String cellTemperatureResource,
        SeriesPlan cellTemperaturePlan,
        Partition cellTemperaturePartition
) {

    // field names shared by the legs and the plans
    public static final String VOLTAGE = "voltage";
    public static final String CURRENT = "current";
    public static final String STATE_OF_CHARGE = "stateOfCharge";
    public static final String TEMP_AVG = "tempAvg";
    public static final String TEMP_MIN = "tempMin";
    public static final String TEMP_MAX = "tempMax";
    public static final String TEMP_MASTER = "tempMaster";

    public static final String SLAVES = "slaves";
    public static final String CELLS = "cells";
    public static final String CELLS_PER_SLAVE = "cellsPerSlave";
    public static final String TEMP_SENSORS = "tempSensors";
    public static final String SAFETY_RESISTORS = "safetyResistors";

    private static final DecodePlan S3_MAIN = DecodePlan.of("Parametersatz",
            decimal(VOLTAGE, 1, 1000.0),       // mV -> V
            decimal(CURRENT, 2, 1.0),
            decimal(STATE_OF_CHARGE, 2, 10.0), // permille -> %
            decimal(TEMP_AVG, 2, 10.0),        // tenths of °C
            decimal(TEMP_MIN, 2, 10.0),
            decimal(TEMP_MAX, 2, 10.0),
            decimal(TEMP_MASTER, 2, 10.0));

    private static final DecodePlan S3_TOPOLOGY = DecodePlan.of("PSet0",
            integer(SLAVES, 0),
            integer(CELLS, 0),
            integer(CELLS_PER_SLAVE, 0),
            integer(TEMP_SENSORS, 0),
            integer(SAFETY_RESISTORS, 0));

    private static final SeriesPlan S3_CELL_MV = new SeriesPlan("PSet", 2, 1.0);
    private static final SeriesPlan S3_CELL_TEMP = new SeriesPlan("PSet", 1, 10.0);

    /** Two racks: 72 cells / 8 sensors on the right, the rest on the left. */
    public static final FirmwareProfile S3 = new FirmwareProfile("s3",
            "main_data.shtml", S3_MAIN,
            "ucell.shtml", S3_TOPOLOGY, S3_CELL_MV, Partition.fixed(72),
            "tcell.shtml", S3_CELL_TEMP, Partition.fixed(8));

    /** Same wire layout, racks split at the middle of each array. */
    public static final FirmwareProfile S3_HALVES = new FirmwareProfile("s3-halves",
            "main_data.shtml", S3_MAIN,
            "ucell.shtml", S3_TOPOLOGY, S3_CELL_MV, Partition.halves(),
            "tcell.shtml", S3_CELL_TEMP, Partition.halves());

    private static final Map<String, FirmwareProfile> BUILT_IN = List.of(S3, S3_HALVES).stream()
            .collect(Collectors.toUnmodifiableMap(FirmwareProfile::name, Function.identity()));

    public static FirmwareProfile byName(String name) {
        FirmwareProfile p = BUILT_IN.get(name == null ? "" : name.trim().toLowerCase(Locale.ROOT));
        if (p == null) {
            throw new IllegalArgumentException("unknown firmware profile '" + name + "', known: "
                    + Arrays.toString(BUILT_IN.keySet().stream().sorted().toArray()));
        }
        return p;
    }
}
