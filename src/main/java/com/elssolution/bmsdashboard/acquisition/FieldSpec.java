package com.elssolution.bmsdashboard.acquisition;

/**
 * One positional field of a decode plan.
 *
 * @param name  diagnostic name, also the lookup key in {@link DecodedFields}
 * @param skip  unlabeled tokens to discard before this field
 * @param type  numeric type of the raw token
 * @param scale divisor applied to the raw value (1 = none)
 */
public record FieldSpec(String name, int skip, FieldType type, double scale) {

    public enum FieldType { INTEGER, DECIMAL }

    public FieldSpec {
        if (skip < 0) throw new IllegalArgumentException("skip < 0 for " + name);
        if (scale == 0.0 || !Double.isFinite(scale)) throw new IllegalArgumentException("bad scale for " + name);
    }

    public static FieldSpec integer(String name, int skip) {
        return new FieldSpec(name, skip, FieldType.INTEGER, 1.0);
    }

    public static FieldSpec decimal(String name, int skip, double scale) {
        return new FieldSpec(name, skip, FieldType.DECIMAL, scale);
    }
}
