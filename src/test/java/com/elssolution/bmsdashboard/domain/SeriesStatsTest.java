package com.elssolution.bmsdashboard.domain;

import com.elssolution.bmsdashboard.error.EmptySeriesException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeriesStatsTest {

    @Test
    void voltage_stats_use_truncated_mean() throws Exception {
        VoltageStats s = SeriesStats.ofMillivolts(new int[]{3700, 3701, 3703});

        assertThat(s.min()).isEqualTo(3700);
        assertThat(s.max()).isEqualTo(3703);
        assertThat(s.avg()).isEqualTo(3701); // 11104 / 3 = 3701.33
        assertThat(s.delta()).isEqualTo(3);
    }

    @Test
    void voltage_stats_restricted_to_sub_range() throws Exception {
        int[] mv = {1000, 3700, 3800, 9000};

        VoltageStats s = SeriesStats.ofMillivolts(mv, 1, 3);

        assertThat(s).isEqualTo(new VoltageStats(3750, 3700, 3800, 100));
    }

    @Test
    void single_sample_has_zero_delta() throws Exception {
        assertThat(SeriesStats.ofMillivolts(new int[]{3650})).isEqualTo(new VoltageStats(3650, 3650, 3650, 0));
    }

    @Test
    void temperature_stats_use_true_division() throws Exception {
        TempStats s = SeriesStats.ofCelsius(new double[]{21.0, 22.0});

        assertThat(s.avg()).isEqualTo(21.5);
        assertThat(s.min()).isEqualTo(21.0);
        assertThat(s.max()).isEqualTo(22.0);
        assertThat(s.delta()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void empty_series_is_rejected() {
        assertThatThrownBy(() -> SeriesStats.ofMillivolts(new int[0])).isInstanceOf(EmptySeriesException.class);
        assertThatThrownBy(() -> SeriesStats.ofCelsius(new double[]{1.0}, 1, 1)).isInstanceOf(EmptySeriesException.class);
        assertThatThrownBy(() -> SeriesStats.meanMillivolts(new int[0])).isInstanceOf(EmptySeriesException.class);
    }

    @Test
    void range_outside_array_is_a_programming_error() {
        assertThatThrownBy(() -> SeriesStats.ofMillivolts(new int[]{1, 2}, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void union_takes_extremes_of_both_groups() {
        VoltageStats right = new VoltageStats(3700, 3650, 3750, 100);
        VoltageStats left = new VoltageStats(3720, 3690, 3810, 120);

        VoltageStats overall = VoltageStats.union(left, right, 3711);

        assertThat(overall).isEqualTo(new VoltageStats(3711, 3650, 3810, 160));
    }
}
