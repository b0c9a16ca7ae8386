package com.elssolution.bmsdashboard.domain;

/**
 * Pack-level scalars from the main panel.
 *
 * @param voltage       pack voltage (V)
 * @param current       pack current as reported by the controller, unscaled
 * @param stateOfCharge state of charge (%)
 * @param tempAvg       average cell temperature (°C)
 * @param tempMin       minimum cell temperature (°C)
 * @param tempMax       maximum cell temperature (°C)
 * @param tempMaster    master controller temperature (°C)
 */
public record MainReading(
        double voltage,
        double current,
        double stateOfCharge,
        double tempAvg,
        double tempMin,
        double tempMax,
        double tempMaster
) {}
