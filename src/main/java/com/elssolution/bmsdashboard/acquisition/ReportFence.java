package com.elssolution.bmsdashboard.acquisition;

/**
 * Secondary, exclusive bounds used only to pick the reported min and max after
 * replacement. The two bounds are tuned independently of the replacement fence.
 *
 * @param minAbove only samples {@code > minAbove} may become the reported min
 * @param maxBelow only samples {@code < maxBelow} may become the reported max
 */
public record ReportFence(double minAbove, double maxBelow) {

    public boolean minCandidate(double v) {
        return v > minAbove;
    }

    public boolean maxCandidate(double v) {
        return v < maxBelow;
    }
}
