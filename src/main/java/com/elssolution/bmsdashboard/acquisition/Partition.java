package com.elssolution.bmsdashboard.acquisition;

/**
 * Fixed index split of a series into two groups. The groups are positional:
 * the first {@code split} samples belong to the right rack, the rest to the left.
 */
public record Partition(Kind kind, int index) {

    public enum Kind { FIXED, HALVES }

    public Partition {
        if (kind == Kind.FIXED && index <= 0) {
            throw new IllegalArgumentException("fixed split index must be > 0, got " + index);
        }
    }

    public static Partition fixed(int index) {
        return new Partition(Kind.FIXED, index);
    }

    public static Partition halves() {
        return new Partition(Kind.HALVES, 0);
    }

    /**
     * Split point for a series of {@code n} samples. A result of 0 or {@code n}
     * means one side is empty and the series is reported as a whole only.
     */
    public int splitIndex(int n) {
        return switch (kind) {
            case FIXED -> Math.min(index, n);
            case HALVES -> n / 2;
        };
    }
}
