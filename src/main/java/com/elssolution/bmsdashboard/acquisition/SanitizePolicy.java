package com.elssolution.bmsdashboard.acquisition;

import java.util.Optional;

/**
 * Outlier handling for one series.
 *
 * @param replace samples outside this fence are replaced by the raw mean
 * @param report  optional stricter fence for the reported min/max; null = plain min/max
 */
public record SanitizePolicy(Fence replace, ReportFence report) {

    public SanitizePolicy {
        if (replace == null) throw new IllegalArgumentException("replace fence required");
    }

    public static SanitizePolicy simple(double lo, double hi) {
        return new SanitizePolicy(new Fence(lo, hi), null);
    }

    public Optional<ReportFence> reportFence() {
        return Optional.ofNullable(report);
    }
}
