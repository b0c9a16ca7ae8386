package com.elssolution.bmsdashboard.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invariants of the single-pass aggregator for arbitrary non-empty series.
 */
class SeriesStatsPropertyTest {

    @Property(tries = 200)
    void voltageDeltaIsSpreadAndAverageLiesWithinBounds(
            @ForAll @Size(min = 1, max = 300) List<@IntRange(min = 0, max = 65535) Integer> samples
    ) throws Exception {
        int[] mv = samples.stream().mapToInt(Integer::intValue).toArray();

        VoltageStats s = SeriesStats.ofMillivolts(mv);

        assertEquals(s.max() - s.min(), s.delta());
        assertTrue(s.min() <= s.avg(), "min <= avg");
        assertTrue(s.avg() <= s.max(), "avg <= max");
    }

    @Property(tries = 200)
    void temperatureDeltaIsSpreadAndAverageLiesWithinBounds(
            @ForAll @Size(min = 1, max = 64) List<@IntRange(min = -400, max = 1200) Integer> tenths
    ) throws Exception {
        double[] t = tenths.stream().mapToDouble(v -> v / 10.0).toArray();

        TempStats s = SeriesStats.ofCelsius(t);

        assertEquals(s.max() - s.min(), s.delta(), 1e-9);
        assertTrue(s.min() <= s.avg() + 1e-9, "min <= avg");
        assertTrue(s.avg() <= s.max() + 1e-9, "avg <= max");
    }

    /**
     * For any split point, the overall group built from the two partitions has the
     * same extremes as the whole array.
     */
    @Property(tries = 200)
    void unionOfPartitionsMatchesWholeArrayExtremes(
            @ForAll @Size(min = 2, max = 200) List<@IntRange(min = 2500, max = 4500) Integer> samples,
            @ForAll @IntRange(min = 1, max = 199) int splitHint
    ) throws Exception {
        int[] mv = samples.stream().mapToInt(Integer::intValue).toArray();
        int split = 1 + (splitHint % (mv.length - 1));

        VoltageStats right = SeriesStats.ofMillivolts(mv, 0, split);
        VoltageStats left = SeriesStats.ofMillivolts(mv, split, mv.length);
        VoltageStats whole = SeriesStats.ofMillivolts(mv);
        VoltageStats overall = VoltageStats.union(left, right, whole.avg());

        assertEquals(Math.min(left.min(), right.min()), overall.min());
        assertEquals(Math.max(left.max(), right.max()), overall.max());
        assertEquals(whole.min(), overall.min());
        assertEquals(whole.max(), overall.max());
        assertEquals(overall.max() - overall.min(), overall.delta());
    }
}
