package com.elssolution.bmsdashboard.acquisition;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Plausibility fences for the sanitizer. Every bound is its own knob; a
 * negative report bound disables that half of the stricter variant.
 */
@Slf4j
@Component
public class SanitizerSettings {

    // replacement fence, mV
    @Value("${bms.sanitize.voltage.lo:3000}") private int voltageLo;
    @Value("${bms.sanitize.voltage.hi:4200}") private int voltageHi;

    // stricter report fence, mV (exclusive); -1 = off
    @Value("${bms.sanitize.voltage.reportMinAbove:-1}") private int voltageReportMinAbove;
    @Value("${bms.sanitize.voltage.reportMaxBelow:-1}") private int voltageReportMaxBelow;

    // °C
    @Value("${bms.sanitize.temp.lo:15.0}") private double tempLo;
    @Value("${bms.sanitize.temp.hi:45.0}") private double tempHi;

    private SanitizePolicy voltagePolicy;
    private SanitizePolicy temperaturePolicy;

    @PostConstruct
    void init() {
        if (voltageLo > voltageHi) {
            log.warn("bms.sanitize.voltage lo > hi ({} > {}). Swapping.", voltageLo, voltageHi);
            int t = voltageLo; voltageLo = voltageHi; voltageHi = t;
        }
        if (tempLo > tempHi) {
            log.warn("bms.sanitize.temp lo > hi ({} > {}). Swapping.", tempLo, tempHi);
            double t = tempLo; tempLo = tempHi; tempHi = t;
        }
        voltagePolicy = new SanitizePolicy(new Fence(voltageLo, voltageHi), reportFence());
        temperaturePolicy = SanitizePolicy.simple(tempLo, tempHi);
        log.info("Sanitizer fences: voltage=[{}..{}]mV report={} temp=[{}..{}]°C",
                voltageLo, voltageHi, voltagePolicy.report(), tempLo, tempHi);
    }

    private ReportFence reportFence() {
        if (voltageReportMinAbove < 0 && voltageReportMaxBelow < 0) return null;
        double minAbove = voltageReportMinAbove < 0 ? Double.NEGATIVE_INFINITY : voltageReportMinAbove;
        double maxBelow = voltageReportMaxBelow < 0 ? Double.POSITIVE_INFINITY : voltageReportMaxBelow;
        return new ReportFence(minAbove, maxBelow);
    }

    public SanitizePolicy voltagePolicy() {
        return voltagePolicy;
    }

    public SanitizePolicy temperaturePolicy() {
        return temperaturePolicy;
    }
}
