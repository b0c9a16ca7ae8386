package com.elssolution.bmsdashboard.acquisition;

/** Inclusive plausibility range; samples strictly outside it are outliers. */
public record Fence(double lo, double hi) {

    public Fence {
        if (!(lo <= hi)) throw new IllegalArgumentException("fence lo > hi: " + lo + " > " + hi);
    }

    public boolean contains(double v) {
        return v >= lo && v <= hi;
    }
}
