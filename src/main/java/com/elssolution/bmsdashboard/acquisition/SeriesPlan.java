package com.elssolution.bmsdashboard.acquisition;

/**
 * Repeating tail of a payload: {@code skip} header tokens, then one sample per token.
 * Raw samples are divided by {@code scale}.
 */
public record SeriesPlan(String key, int skip, double scale) {

    public SeriesPlan {
        if (skip < 0) throw new IllegalArgumentException("skip < 0 for " + key);
        if (scale == 0.0 || !Double.isFinite(scale)) throw new IllegalArgumentException("bad scale for " + key);
    }
}
