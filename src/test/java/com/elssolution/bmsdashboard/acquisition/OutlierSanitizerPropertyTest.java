package com.elssolution.bmsdashboard.acquisition;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of the voltage sanitizer with the default 3000..4200 mV fence.
 */
class OutlierSanitizerPropertyTest {

    private static final Fence FENCE = new Fence(3000, 4200);

    /**
     * An in-range array is left untouched, however often it is sanitized.
     */
    @Property(tries = 200)
    void sanitizingInRangeArrayIsIdempotent(
            @ForAll @Size(min = 1, max = 200) List<@IntRange(min = 3000, max = 4200) Integer> samples
    ) throws Exception {
        int[] mv = samples.stream().mapToInt(Integer::intValue).toArray();
        int[] original = mv.clone();

        OutlierSanitizer.sanitizeMillivolts(mv, FENCE);
        int[] once = mv.clone();
        OutlierSanitizer.sanitizeMillivolts(mv, FENCE);

        assertArrayEquals(original, once);
        assertArrayEquals(once, mv);
    }

    /**
     * Exactly one outlier: only that slot changes, and it becomes the truncated
     * mean of the raw array.
     */
    @Property(tries = 200)
    void singleOutlierReplacedByRawMean(
            @ForAll @Size(min = 1, max = 150) List<@IntRange(min = 3000, max = 4200) Integer> samples,
            @ForAll @IntRange(min = 4201, max = 65535) int outlier,
            @ForAll @IntRange(min = 0, max = 1000) int positionHint
    ) throws Exception {
        int n = samples.size() + 1;
        int pos = positionHint % n;
        int[] mv = new int[n];
        long sum = 0;
        for (int i = 0, j = 0; i < n; i++) {
            mv[i] = (i == pos) ? outlier : samples.get(j++);
            sum += mv[i];
        }
        int[] raw = mv.clone();

        OutlierSanitizer.sanitizeMillivolts(mv, FENCE);

        for (int i = 0; i < n; i++) {
            if (i == pos) {
                assertEquals((int) (sum / n), mv[i]);
            } else {
                assertEquals(raw[i], mv[i]);
            }
        }
    }
}
